package io.deskrelay.ticket;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Collects field-level validation failures before raising them together. */
final class FieldErrors {
    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    void add(String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }

    void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            add(field, field + " is required");
        } else if (value.length() > maxLength) {
            add(field, field + " must be at most " + maxLength + " characters");
        }
    }

    void maxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            add(field, field + " must be at most " + maxLength + " characters");
        }
    }

    void throwIfAny() {
        if (!errors.isEmpty()) {
            throw new TicketValidationException(errors);
        }
    }
}
