package io.deskrelay.spi;

/**
 * Fire-and-forget delivery of {@link Notification}s.
 *
 * <p>Called from a background executor after the triggering transaction commits.
 * Exceptions are logged and never reach the user whose action caused the message.
 */
@FunctionalInterface
public interface Notifier {

    void send(Notification notification) throws Exception;

    /** Discards every notification. */
    Notifier NOOP = notification -> {
    };
}
