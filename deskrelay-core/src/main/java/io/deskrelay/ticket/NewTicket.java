package io.deskrelay.ticket;

import java.util.UUID;

/**
 * Unvalidated input for {@link Ticket#open(NewTicket, java.time.Instant)}.
 *
 * <p>{@code priority} is kept as the raw wire value so that an unknown priority is
 * reported together with every other invalid field.
 *
 * @param title       required, at most 255 characters
 * @param description optional, at most 10000 characters
 * @param priority    one of {@code LOW}, {@code MEDIUM}, {@code HIGH} (case-insensitive)
 * @param requesterId the user filing the ticket
 */
public record NewTicket(String title, String description, String priority, UUID requesterId) {

    public static NewTicket of(String title, String description, TicketPriority priority, UUID requesterId) {
        return new NewTicket(title, description, priority == null ? null : priority.name(), requesterId);
    }
}
