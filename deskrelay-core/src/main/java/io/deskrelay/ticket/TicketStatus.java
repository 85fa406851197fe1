package io.deskrelay.ticket;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a ticket.
 *
 * <p>Allowed transitions: {@code OPEN <-> IN_PROGRESS}, {@code OPEN -> CLOSED},
 * {@code IN_PROGRESS -> CLOSED}. {@code CLOSED} is terminal, and re-entering the
 * current state is never a transition.
 */
public enum TicketStatus {
    OPEN,
    IN_PROGRESS,
    CLOSED;

    /**
     * Returns the states reachable from this one in a single transition.
     */
    public Set<TicketStatus> successors() {
        return switch (this) {
            case OPEN -> EnumSet.of(IN_PROGRESS, CLOSED);
            case IN_PROGRESS -> EnumSet.of(OPEN, CLOSED);
            case CLOSED -> EnumSet.noneOf(TicketStatus.class);
        };
    }

    public boolean canTransitionTo(TicketStatus next) {
        return next != null && successors().contains(next);
    }

    /**
     * Parses a wire value such as {@code "in_progress"}, ignoring case and
     * surrounding whitespace.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    public static TicketStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ticket status: " + value, e);
        }
    }
}
