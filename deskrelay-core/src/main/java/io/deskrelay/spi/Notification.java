package io.deskrelay.spi;

import java.util.Objects;
import java.util.UUID;

/**
 * A best-effort out-of-band message, such as an email to the ticket requester.
 *
 * @param recipientId user to notify
 * @param ticketId    ticket the message is about
 * @param subject     short subject line
 * @param body        message text
 */
public record Notification(UUID recipientId, long ticketId, String subject, String body) {

    public Notification {
        Objects.requireNonNull(recipientId, "recipientId");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(body, "body");
    }
}
