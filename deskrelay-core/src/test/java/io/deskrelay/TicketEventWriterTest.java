package io.deskrelay;

import io.deskrelay.event.EventType;
import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.spi.MetricsExporter;
import io.deskrelay.spi.TicketEventStore;
import io.deskrelay.spi.TxContext;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicketEventWriterTest {
  private static final UUID ACTOR = UUID.randomUUID();

  @Test
  void appendThrowsWhenNoActiveTransaction() {
    StubTxContext txContext = new StubTxContext(false);
    RecordingEventStore store = new RecordingEventStore();

    TicketEventWriter writer = new TicketEventWriter(txContext, store);

    assertThrows(IllegalStateException.class, () -> writer.append(event(1)));
    assertEquals(0, store.appended.size());
  }

  @Test
  void appendReturnsStoredEventWithGeneratedId() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingEventStore store = new RecordingEventStore();

    TicketEventWriter writer = new TicketEventWriter(txContext, store);
    TicketEvent first = writer.append(event(7));
    TicketEvent second = writer.append(event(7));

    assertEquals(1, first.id());
    assertEquals(2, second.id());
    assertEquals(7, second.ticketId());
  }

  @Test
  void hookSeesEventOnlyAfterCommit() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingEventStore store = new RecordingEventStore();
    RecordingHook hook = new RecordingHook();

    TicketEventWriter writer = new TicketEventWriter(txContext, store, hook, null);
    TicketEvent appended = writer.append(event(3));

    assertEquals(List.of(appended), hook.appended);
    assertTrue(hook.committed.isEmpty());

    txContext.runAfterCommit();

    assertEquals(List.of(appended), hook.committed);
    assertTrue(hook.rolledBack.isEmpty());
  }

  @Test
  void rollbackNeverReachesAfterCommit() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingHook hook = new RecordingHook();

    TicketEventWriter writer = new TicketEventWriter(txContext, new RecordingEventStore(), hook, null);
    writer.append(event(3));

    txContext.runAfterRollback();

    assertTrue(hook.committed.isEmpty());
    assertEquals(1, hook.rolledBack.size());
  }

  @Test
  void hookFailuresDoNotReachCaller() {
    StubTxContext txContext = new StubTxContext(true);
    WriterHook failing = new WriterHook() {
      @Override
      public void afterAppend(TicketEvent event) {
        throw new RuntimeException("boom");
      }

      @Override
      public void afterCommit(TicketEvent event) {
        throw new RuntimeException("boom");
      }
    };

    TicketEventWriter writer = new TicketEventWriter(txContext, new RecordingEventStore(), failing, null);

    assertDoesNotThrow(() -> writer.append(event(1)));
    assertDoesNotThrow(txContext::runAfterCommit);
  }

  @Test
  void committedEventsAreCounted() {
    StubTxContext txContext = new StubTxContext(true);
    CountingMetrics metrics = new CountingMetrics();

    TicketEventWriter writer = new TicketEventWriter(txContext, new RecordingEventStore(), null, metrics);
    writer.appendAll(List.of(event(1), event(1), event(2)));
    assertEquals(0, metrics.committed.get());

    txContext.runAfterCommit();
    assertEquals(3, metrics.committed.get());
  }

  @Test
  void appendAllStoresBatchInOrderAndCommitsInOrder() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingEventStore store = new RecordingEventStore();
    RecordingHook hook = new RecordingHook();

    TicketEventWriter writer = new TicketEventWriter(txContext, store, hook, null);
    List<TicketEvent> batch = writer.appendAll(List.of(event(4), event(5), event(4)));

    assertEquals(List.of(1L, 2L, 3L), batch.stream().map(TicketEvent::id).toList());
    assertEquals(List.of(4L, 5L, 4L), batch.stream().map(TicketEvent::ticketId).toList());
    assertEquals(store.appended, batch);
    assertEquals(batch, hook.appended);
    assertEquals(1, txContext.afterCommit.size());

    txContext.runAfterCommit();

    assertEquals(batch, hook.committed);
  }

  @Test
  void rolledBackBatchReportsEveryEvent() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingHook hook = new RecordingHook();

    TicketEventWriter writer = new TicketEventWriter(txContext, new RecordingEventStore(), hook, null);
    List<TicketEvent> batch = writer.appendAll(List.of(event(4), event(5)));

    txContext.runAfterRollback();

    assertEquals(batch, hook.rolledBack);
    assertTrue(hook.committed.isEmpty());
  }

  @Test
  void appendAllWithEmptyListWritesNothing() {
    StubTxContext txContext = new StubTxContext(true);
    RecordingEventStore store = new RecordingEventStore();

    List<TicketEvent> result = new TicketEventWriter(txContext, store).appendAll(List.of());

    assertTrue(result.isEmpty());
    assertTrue(txContext.afterCommit.isEmpty());
  }

  private static NewTicketEvent event(long ticketId) {
    return new NewTicketEvent(ticketId, EventType.STATUS_UPDATED, "{\"id\":" + ticketId + "}", ACTOR, Instant.now());
  }

  private static final class StubTxContext implements TxContext {
    private final boolean active;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private StubTxContext(boolean active) {
      this.active = active;
    }

    @Override
    public boolean isTransactionActive() {
      return active;
    }

    @Override
    public Connection currentConnection() {
      return null;
    }

    @Override
    public void afterCommit(Runnable callback) {
      afterCommit.add(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
      afterRollback.add(callback);
    }

    void runAfterCommit() {
      afterCommit.forEach(Runnable::run);
    }

    void runAfterRollback() {
      afterRollback.forEach(Runnable::run);
    }
  }

  private static final class RecordingEventStore implements TicketEventStore {
    private final List<TicketEvent> appended = new ArrayList<>();

    @Override
    public TicketEvent append(Connection conn, NewTicketEvent event) {
      TicketEvent stored = event.withId(appended.size() + 1);
      appended.add(stored);
      return stored;
    }

    @Override
    public List<TicketEvent> listByTicket(Connection conn, long ticketId, long afterId, int limit) {
      return List.of();
    }

    @Override
    public long countByTicket(Connection conn, long ticketId) {
      return appended.stream().filter(e -> e.ticketId() == ticketId).count();
    }
  }

  private static final class RecordingHook implements WriterHook {
    private final List<TicketEvent> appended = new ArrayList<>();
    private final List<TicketEvent> committed = new ArrayList<>();
    private final List<TicketEvent> rolledBack = new ArrayList<>();

    @Override
    public void afterAppend(TicketEvent event) {
      appended.add(event);
    }

    @Override
    public void afterCommit(TicketEvent event) {
      committed.add(event);
    }

    @Override
    public void afterRollback(TicketEvent event) {
      rolledBack.add(event);
    }
  }

  private static final class CountingMetrics extends MetricsExporterAdapter {
    private final AtomicInteger committed = new AtomicInteger();

    @Override
    public void incrementEventsCommitted() {
      committed.incrementAndGet();
    }
  }

  private abstract static class MetricsExporterAdapter implements MetricsExporter {
    @Override public void incrementEventsCommitted() {}
    @Override public void incrementBroadcastEnqueued() {}
    @Override public void incrementBroadcastDropped() {}
    @Override public void incrementDelivered() {}
    @Override public void incrementSessionsEvicted() {}
    @Override public void recordDispatchQueueDepth(int depth) {}
  }
}
