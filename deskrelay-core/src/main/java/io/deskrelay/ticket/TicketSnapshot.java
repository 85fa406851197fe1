package io.deskrelay.ticket;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable view of a ticket embedded in event payloads.
 *
 * <p>Timestamps are ISO-8601 strings; absent optionals serialize as JSON {@code null}.
 */
public record TicketSnapshot(
        long id,
        String title,
        String description,
        String status,
        String priority,
        String requesterId,
        String assigneeId,
        String createdAt,
        String updatedAt,
        String closedAt
) {

    public static TicketSnapshot of(Ticket ticket) {
        return new TicketSnapshot(
                ticket.id(),
                ticket.title(),
                ticket.description(),
                ticket.status().name(),
                ticket.priority().name(),
                ticket.requesterId().toString(),
                text(ticket.assigneeId()),
                ticket.createdAt().toString(),
                text(ticket.updatedAt()),
                text(ticket.closedAt()));
    }

    private static String text(UUID value) {
        return value == null ? null : value.toString();
    }

    private static String text(Instant value) {
        return value == null ? null : value.toString();
    }
}
