package io.deskrelay;

/**
 * Unchecked wrapper for persistence failures, typically a {@link java.sql.SQLException}.
 */
public class DeskRelayStoreException extends RuntimeException {

    public DeskRelayStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
