package io.deskrelay.event;

/**
 * Kinds of facts recorded in the ticket event log. The name is the wire value of
 * the {@code type} field in server frames.
 */
public enum EventType {
    TICKET_CREATED,
    STATUS_UPDATED,
    TICKET_ASSIGNED,
    COMMENT_ADDED
}
