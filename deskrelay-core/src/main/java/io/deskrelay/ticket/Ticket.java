package io.deskrelay.ticket;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * The ticket aggregate: a support request with a bounded status lifecycle.
 *
 * <p>Instances are mutable and not thread-safe. Callers load a ticket inside a
 * transaction that holds its row lock, apply one transition, and persist it
 * before the transaction ends. Timestamps are truncated to milliseconds so they
 * survive a database round trip unchanged.
 *
 * @see TicketStatus
 */
public final class Ticket {
    public static final int MAX_TITLE_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 10_000;

    private final long id;
    private final String title;
    private final String description;
    private final TicketPriority priority;
    private final UUID requesterId;
    private final Instant createdAt;
    private TicketStatus status;
    private UUID assigneeId;
    private Instant updatedAt;
    private Instant closedAt;

    private Ticket(long id, String title, String description, TicketStatus status,
                   TicketPriority priority, UUID requesterId, UUID assigneeId,
                   Instant createdAt, Instant updatedAt, Instant closedAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.requesterId = requesterId;
        this.assigneeId = assigneeId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.closedAt = closedAt;
    }

    /**
     * Validates the input and creates an unsaved {@link TicketStatus#OPEN} ticket.
     *
     * @param input the requested ticket
     * @param now   creation time
     * @return a ticket with id {@code 0}; the store assigns the real id
     * @throws TicketValidationException listing every invalid field
     */
    public static Ticket open(NewTicket input, Instant now) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(now, "now");
        FieldErrors errors = new FieldErrors();
        String title = input.title() == null ? null : input.title().trim();
        errors.requireText("title", title, MAX_TITLE_LENGTH);
        errors.maxLength("description", input.description(), MAX_DESCRIPTION_LENGTH);
        TicketPriority priority = null;
        if (input.priority() == null || input.priority().isBlank()) {
            errors.add("priority", "priority is required");
        } else {
            try {
                priority = TicketPriority.parse(input.priority());
            } catch (IllegalArgumentException e) {
                errors.add("priority", "priority must be one of LOW, MEDIUM, HIGH");
            }
        }
        if (input.requesterId() == null) {
            errors.add("requesterId", "requesterId is required");
        }
        errors.throwIfAny();

        String description = input.description() == null ? "" : input.description();
        return new Ticket(0L, title, description, TicketStatus.OPEN, priority,
                input.requesterId(), null, millis(now), null, null);
    }

    /**
     * Rebuilds a persisted ticket. No validation is applied.
     */
    public static Ticket restore(long id, String title, String description, TicketStatus status,
                                 TicketPriority priority, UUID requesterId, UUID assigneeId,
                                 Instant createdAt, Instant updatedAt, Instant closedAt) {
        return new Ticket(id, title, description, Objects.requireNonNull(status, "status"),
                Objects.requireNonNull(priority, "priority"),
                Objects.requireNonNull(requesterId, "requesterId"),
                assigneeId, Objects.requireNonNull(createdAt, "createdAt"), updatedAt, closedAt);
    }

    /**
     * Returns a copy carrying the id the store generated.
     */
    public Ticket withId(long newId) {
        if (newId <= 0) {
            throw new IllegalArgumentException("id must be > 0");
        }
        return new Ticket(newId, title, description, status, priority, requesterId, assigneeId,
                createdAt, updatedAt, closedAt);
    }

    /**
     * Moves the ticket to {@code next}, stamping {@code updatedAt}, and {@code closedAt}
     * when entering {@link TicketStatus#CLOSED}.
     *
     * @throws InvalidStateTransitionException if the transition is not allowed,
     *                                         including re-entering the current status
     */
    public void updateStatus(TicketStatus next, Instant now) {
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(now, "now");
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateTransitionException(id, status, next);
        }
        Instant at = millis(now);
        status = next;
        updatedAt = at;
        if (next == TicketStatus.CLOSED) {
            closedAt = at;
        }
    }

    /**
     * Sets the assignee. The status is left unchanged.
     *
     * @throws ClosedTicketException if the ticket is closed
     */
    public void assign(UUID assignee, Instant now) {
        Objects.requireNonNull(assignee, "assignee");
        Objects.requireNonNull(now, "now");
        if (status == TicketStatus.CLOSED) {
            throw new ClosedTicketException(id);
        }
        assigneeId = assignee;
        updatedAt = millis(now);
    }

    /**
     * Returns {@code true} if the user filed or is assigned to this ticket.
     */
    public boolean isParticipant(UUID userId) {
        return userId != null && (userId.equals(requesterId) || userId.equals(assigneeId));
    }

    public long id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public TicketStatus status() {
        return status;
    }

    public TicketPriority priority() {
        return priority;
    }

    public UUID requesterId() {
        return requesterId;
    }

    public UUID assigneeId() {
        return assigneeId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant closedAt() {
        return closedAt;
    }

    private static Instant millis(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public String toString() {
        return "Ticket{id=" + id + ", status=" + status + ", priority=" + priority
                + ", requesterId=" + requesterId + ", assigneeId=" + assigneeId + '}';
    }
}
