package io.deskrelay.hub;

/**
 * A client-to-server control frame, e.g. {@code {"type":"SUBSCRIBE_TO_TICKET","payload":{"ticketId":7}}}.
 */
record ControlMessage(String type, Payload payload) {
  static final String SUBSCRIBE = "SUBSCRIBE_TO_TICKET";
  static final String UNSUBSCRIBE = "UNSUBSCRIBE_FROM_TICKET";
  static final String PING = "PING";

  record Payload(Long ticketId) {
  }

  Long targetTicketId() {
    return payload == null ? null : payload.ticketId();
  }
}
