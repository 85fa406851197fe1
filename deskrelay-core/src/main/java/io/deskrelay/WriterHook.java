package io.deskrelay;

import io.deskrelay.event.TicketEvent;

/**
 * Lifecycle hook for {@link TicketEventWriter} appends.
 *
 * <p>Use {@link io.deskrelay.hub.HubWriterHook} to hand committed events to the
 * subscription hub. The {@link #NOOP} instance does nothing, leaving clients to
 * find events through catch-up reads.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Store appends the event on the transaction's connection</li>
 *   <li>{@link #afterAppend}: observational, exceptions logged</li>
 *   <li>Transaction commits or rolls back</li>
 *   <li>{@link #afterCommit} or {@link #afterRollback}: exceptions logged</li>
 * </ol>
 *
 * <p>None of these methods can fail the caller's transaction.
 */
public interface WriterHook {

    /**
     * Called after the event row is inserted but before the transaction commits.
     */
    default void afterAppend(TicketEvent event) {
    }

    /**
     * Called after the enclosing transaction commits successfully.
     */
    default void afterCommit(TicketEvent event) {
    }

    /**
     * Called after the enclosing transaction rolls back. The event no longer exists.
     */
    default void afterRollback(TicketEvent event) {
    }

    /**
     * No-op hook; the default in {@link TicketEventWriter}.
     */
    WriterHook NOOP = new WriterHook() {
    };
}
