package io.deskrelay.micrometer;

import io.deskrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code deskrelay.events.committed}: events whose transaction committed</li>
 *   <li>{@code deskrelay.broadcast.enqueued}: events accepted by the hub dispatch queue</li>
 *   <li>{@code deskrelay.broadcast.dropped}: events dropped (dispatch queue full or hub closed)</li>
 *   <li>{@code deskrelay.delivered}: messages placed on a session's outbound queue</li>
 *   <li>{@code deskrelay.sessions.evicted}: sessions evicted as slow consumers</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code deskrelay.dispatch.queue.depth}: events waiting to be fanned out</li>
 *   <li>{@code deskrelay.sessions.connected}: registered sessions</li>
 *   <li>{@code deskrelay.rooms.active}: tickets with at least one subscriber</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsCommitted;
  private final Counter broadcastEnqueued;
  private final Counter broadcastDropped;
  private final Counter delivered;
  private final Counter sessionsEvicted;
  private final Gauge dispatchDepthGauge;
  private final Gauge connectionsGauge;
  private final Gauge roomsGauge;

  private final AtomicInteger dispatchDepth = new AtomicInteger();
  private final AtomicInteger connections = new AtomicInteger();
  private final AtomicInteger rooms = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "deskrelay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "deskrelay");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.realtime"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsCommitted = Counter.builder(namePrefix + ".events.committed")
        .description("Ticket events whose transaction committed")
        .register(registry);
    this.broadcastEnqueued = Counter.builder(namePrefix + ".broadcast.enqueued")
        .description("Committed events accepted for fan-out")
        .register(registry);
    this.broadcastDropped = Counter.builder(namePrefix + ".broadcast.dropped")
        .description("Committed events dropped before fan-out")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".delivered")
        .description("Messages queued to client sessions")
        .register(registry);
    this.sessionsEvicted = Counter.builder(namePrefix + ".sessions.evicted")
        .description("Sessions evicted because their outbound queue was full")
        .register(registry);

    this.dispatchDepthGauge = Gauge.builder(namePrefix + ".dispatch.queue.depth", dispatchDepth, AtomicInteger::get)
        .register(registry);
    this.connectionsGauge = Gauge.builder(namePrefix + ".sessions.connected", connections, AtomicInteger::get)
        .register(registry);
    this.roomsGauge = Gauge.builder(namePrefix + ".rooms.active", rooms, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEventsCommitted() {
    if (closed) return;
    eventsCommitted.increment();
  }

  @Override
  public void incrementBroadcastEnqueued() {
    if (closed) return;
    broadcastEnqueued.increment();
  }

  @Override
  public void incrementBroadcastDropped() {
    if (closed) return;
    broadcastDropped.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementSessionsEvicted() {
    if (closed) return;
    sessionsEvicted.increment();
  }

  @Override
  public void recordDispatchQueueDepth(int depth) {
    if (closed) return;
    dispatchDepth.set(depth);
  }

  @Override
  public void recordRegistrySize(int connections, int rooms) {
    if (closed) return;
    this.connections.set(connections);
    this.rooms.set(rooms);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsCommitted, broadcastEnqueued, broadcastDropped,
        delivered, sessionsEvicted, dispatchDepthGauge, connectionsGauge, roomsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
