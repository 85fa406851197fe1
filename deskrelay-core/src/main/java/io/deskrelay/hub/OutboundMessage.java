package io.deskrelay.hub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonRawValue;
import io.deskrelay.event.TicketEvent;

import java.util.Objects;

/**
 * A server-to-client frame waiting in a session's outbound queue.
 *
 * <p>Encodes as {@code {"type":..,"ticketId":..,"eventId":..,"payload":{..}}}; absent
 * fields are omitted, so a pong is just {@code {"type":"PONG"}}. {@code payload} is
 * already JSON and is embedded verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "ticketId", "eventId", "payload"})
public record OutboundMessage(String type, Long ticketId, Long eventId, @JsonRawValue String payload) {
    public static final String PONG = "PONG";

    private static final OutboundMessage PONG_MESSAGE = new OutboundMessage(PONG, null, null, null);

    public OutboundMessage {
        Objects.requireNonNull(type, "type");
    }

    /**
     * Frame carrying a committed event to subscribers of its ticket.
     */
    public static OutboundMessage event(TicketEvent event) {
        return new OutboundMessage(event.type().name(), event.ticketId(), event.id(), event.payloadJson());
    }

    public static OutboundMessage pong() {
        return PONG_MESSAGE;
    }
}
