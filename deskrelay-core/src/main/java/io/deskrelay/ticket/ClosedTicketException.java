package io.deskrelay.ticket;

/** Raised when assigning a ticket that is already closed. */
public class ClosedTicketException extends TicketStateException {

    public ClosedTicketException(long ticketId) {
        super(ticketId, TicketStatus.CLOSED, "Cannot assign closed ticket " + ticketId);
    }
}
