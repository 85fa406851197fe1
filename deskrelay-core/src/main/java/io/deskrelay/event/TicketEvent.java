package io.deskrelay.event;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted, immutable entry of the ticket event log.
 *
 * <p>{@code id} is unique and strictly increasing across the whole log, which gives
 * every ticket a total order of its events. Clients use the id of the last event
 * they processed as the cursor for catch-up reads.
 */
public record TicketEvent(long id, long ticketId, EventType type, String payloadJson, UUID actorId, Instant createdAt) {

    public TicketEvent {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be > 0");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payloadJson, "payloadJson");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
