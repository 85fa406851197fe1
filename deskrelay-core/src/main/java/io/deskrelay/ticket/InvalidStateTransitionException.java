package io.deskrelay.ticket;

public class InvalidStateTransitionException extends TicketStateException {
    private final TicketStatus requestedStatus;

    public InvalidStateTransitionException(long ticketId, TicketStatus from, TicketStatus to) {
        super(ticketId, from, "Invalid status transition from " + from + " to " + to
                + " for ticket " + ticketId);
        this.requestedStatus = to;
    }

    public TicketStatus requestedStatus() {
        return requestedStatus;
    }
}
