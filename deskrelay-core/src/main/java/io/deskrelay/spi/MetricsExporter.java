package io.deskrelay.spi;

/**
 * Observability hook for exporting event log and hub counters and gauges to a
 * metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. See
 * {@code io.deskrelay.micrometer.MicrometerMetricsExporter} for a Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events whose transaction committed.
     */
    void incrementEventsCommitted();

    /**
     * Increments the count of committed events accepted by the hub dispatch queue.
     */
    void incrementBroadcastEnqueued();

    /**
     * Increments the count of events dropped because the dispatch queue was full
     * or the hub was closed. Dropped events remain available through catch-up reads.
     */
    void incrementBroadcastDropped();

    /**
     * Increments the count of messages placed on a session's outbound queue.
     */
    void incrementDelivered();

    /**
     * Increments the count of sessions evicted because their outbound queue was full.
     */
    void incrementSessionsEvicted();

    /**
     * Records the current depth of the hub dispatch queue.
     *
     * @param depth number of events waiting to be fanned out
     */
    void recordDispatchQueueDepth(int depth);

    /**
     * Records the size of the hub registries after a change.
     *
     * @param connections registered sessions
     * @param rooms       tickets with at least one subscriber
     */
    default void recordRegistrySize(int connections, int rooms) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsCommitted() {
        }

        @Override
        public void incrementBroadcastEnqueued() {
        }

        @Override
        public void incrementBroadcastDropped() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementSessionsEvicted() {
        }

        @Override
        public void recordDispatchQueueDepth(int depth) {
        }
    }
}
