package io.deskrelay.ticket;

import java.util.Locale;

public enum TicketPriority {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if the value names no priority
     */
    public static TicketPriority parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("priority is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ticket priority: " + value, e);
        }
    }
}
