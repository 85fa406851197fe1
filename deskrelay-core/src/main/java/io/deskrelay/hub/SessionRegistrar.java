package io.deskrelay.hub;

/**
 * The only hub operations a session may invoke, and only on itself. The hub owns
 * all membership; a session never reaches the hub's registries directly.
 */
interface SessionRegistrar {

  boolean join(ClientSession session, long ticketId);

  void leave(ClientSession session, long ticketId);

  void release(ClientSession session);
}
