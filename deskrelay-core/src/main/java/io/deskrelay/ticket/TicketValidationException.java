package io.deskrelay.ticket;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when ticket or comment input fails validation.
 *
 * <p>All violations are collected before throwing, so {@link #errors()} reports
 * every offending field at once rather than only the first.
 */
public class TicketValidationException extends RuntimeException {
    private final Map<String, List<String>> errors;

    public TicketValidationException(Map<String, List<String>> errors) {
        super(describe(errors));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.errors = Map.copyOf(copy);
    }

    public TicketValidationException(String field, String message) {
        this(Map.of(field, List.of(message)));
    }

    /**
     * Returns field name to messages, never empty.
     */
    public Map<String, List<String>> errors() {
        return errors;
    }

    private static String describe(Map<String, List<String>> errors) {
        StringBuilder sb = new StringBuilder("Validation failed");
        String sep = ": ";
        for (Map.Entry<String, List<String>> entry : errors.entrySet()) {
            for (String message : entry.getValue()) {
                sb.append(sep).append(message);
                sep = "; ";
            }
        }
        return sb.toString();
    }
}
