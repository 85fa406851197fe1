package io.deskrelay.event;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * An event not yet appended to the log; the store assigns its id.
 *
 * @param ticketId    the ticket the event belongs to
 * @param type        what happened
 * @param payloadJson snapshot of the ticket or comment as JSON
 * @param actorId     the user who caused the event
 * @param createdAt   event time, truncated to milliseconds
 */
public record NewTicketEvent(long ticketId, EventType type, String payloadJson, UUID actorId, Instant createdAt) {

    public NewTicketEvent {
        if (ticketId <= 0) {
            throw new IllegalArgumentException("ticketId must be > 0");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payloadJson, "payloadJson");
        Objects.requireNonNull(actorId, "actorId");
        createdAt = Objects.requireNonNull(createdAt, "createdAt").truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Materializes the committed form once the store has generated {@code id}.
     */
    public TicketEvent withId(long id) {
        return new TicketEvent(id, ticketId, type, payloadJson, actorId, createdAt);
    }
}
