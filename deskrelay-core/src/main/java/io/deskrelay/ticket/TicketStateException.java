package io.deskrelay.ticket;

/**
 * Base type for operations rejected by the ticket lifecycle.
 *
 * @see InvalidStateTransitionException
 * @see ClosedTicketException
 */
public abstract class TicketStateException extends RuntimeException {
    private final long ticketId;
    private final TicketStatus currentStatus;

    protected TicketStateException(long ticketId, TicketStatus currentStatus, String message) {
        super(message);
        this.ticketId = ticketId;
        this.currentStatus = currentStatus;
    }

    public long ticketId() {
        return ticketId;
    }

    public TicketStatus currentStatus() {
        return currentStatus;
    }
}
