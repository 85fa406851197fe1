package io.deskrelay.hub;

import java.util.UUID;

/**
 * Decides whether a connected user may join a ticket's room.
 */
@FunctionalInterface
public interface SubscriptionPolicy {

  boolean mayJoin(UUID userId, long ticketId);

  SubscriptionPolicy ALLOW_ALL = (userId, ticketId) -> true;
}
