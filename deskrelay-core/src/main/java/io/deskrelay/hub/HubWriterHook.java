package io.deskrelay.hub;

import io.deskrelay.WriterHook;
import io.deskrelay.event.TicketEvent;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges {@link io.deskrelay.TicketEventWriter} to the {@link SubscriptionHub}: once
 * the transaction commits, each event is offered to {@link SubscriptionHub#broadcast}.
 *
 * <p>Runs on the committing thread, so it only enqueues. A drop is already logged
 * and counted by the hub.
 */
public final class HubWriterHook implements WriterHook {
  private static final Logger logger = Logger.getLogger(HubWriterHook.class.getName());

  private final SubscriptionHub hub;

  public HubWriterHook(SubscriptionHub hub) {
    this.hub = Objects.requireNonNull(hub, "hub");
  }

  @Override
  public void afterCommit(TicketEvent event) {
    try {
      hub.broadcast(event);
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "Failed to broadcast eventId=" + event.id()
          + "; subscribers must catch up", ex);
    }
  }
}
