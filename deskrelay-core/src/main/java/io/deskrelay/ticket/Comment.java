package io.deskrelay.ticket;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * A comment posted on a ticket. Comments are immutable once stored.
 *
 * @param id        store-assigned id, {@code 0} before insertion
 * @param ticketId  the commented ticket
 * @param authorId  the commenting user
 * @param body      comment text, at most {@link #MAX_BODY_LENGTH} characters
 * @param createdAt creation time
 */
public record Comment(long id, long ticketId, UUID authorId, String body, Instant createdAt) {
    public static final int MAX_BODY_LENGTH = 10_000;

    public Comment {
        Objects.requireNonNull(authorId, "authorId");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Validates input and creates an unsaved comment.
     *
     * @throws TicketValidationException listing every invalid field
     */
    public static Comment create(long ticketId, UUID authorId, String body, Instant now) {
        FieldErrors errors = new FieldErrors();
        if (ticketId <= 0) {
            errors.add("ticketId", "ticketId must be positive");
        }
        if (authorId == null) {
            errors.add("authorId", "authorId is required");
        }
        errors.requireText("body", body, MAX_BODY_LENGTH);
        errors.throwIfAny();
        return new Comment(0L, ticketId, authorId, body, now.truncatedTo(ChronoUnit.MILLIS));
    }

    public Comment withId(long newId) {
        return new Comment(newId, ticketId, authorId, body, createdAt);
    }
}
