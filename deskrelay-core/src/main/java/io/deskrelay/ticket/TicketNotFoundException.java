package io.deskrelay.ticket;

public class TicketNotFoundException extends RuntimeException {
    private final long ticketId;

    public TicketNotFoundException(long ticketId) {
        super("Ticket not found: " + ticketId);
        this.ticketId = ticketId;
    }

    public long ticketId() {
        return ticketId;
    }
}
