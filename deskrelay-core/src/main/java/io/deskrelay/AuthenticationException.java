package io.deskrelay;

/**
 * A realtime connection presented a missing or invalid credential and was
 * refused before any session state was created.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
