/**
 * Real-time fan-out: the {@link io.deskrelay.hub.SubscriptionHub}, client sessions and
 * the {@link io.deskrelay.hub.SessionGateway} that admits them.
 *
 * <h2>Wire frames</h2>
 * <p>Client to server:
 * <pre>{@code
 * {"type":"SUBSCRIBE_TO_TICKET","payload":{"ticketId":7}}
 * {"type":"UNSUBSCRIBE_FROM_TICKET","payload":{"ticketId":7}}
 * {"type":"PING"}
 * }</pre>
 * Server to client:
 * <pre>{@code
 * {"type":"STATUS_UPDATED","ticketId":7,"eventId":42,"payload":{...ticket snapshot...}}
 * {"type":"PONG"}
 * }</pre>
 * Malformed frames and unknown types are logged and ignored.
 */
package io.deskrelay.hub;
