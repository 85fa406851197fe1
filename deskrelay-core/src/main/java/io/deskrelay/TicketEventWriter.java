package io.deskrelay;

import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.spi.MetricsExporter;
import io.deskrelay.spi.TicketEventStore;
import io.deskrelay.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends ticket events inside the caller's transaction: the outbox half of every
 * ticket mutation.
 *
 * <p>The event row is written on the same connection as the ticket change, so both
 * commit or neither does. Only after the commit is the event handed to the
 * configured {@link WriterHook}, which typically broadcasts it to live sessions.
 * Hook failures are logged and never affect the transaction.
 *
 * @see WriterHook
 * @see io.deskrelay.spi.TxContext
 * @see io.deskrelay.spi.TicketEventStore
 */
public final class TicketEventWriter {
    private static final Logger logger = Logger.getLogger(TicketEventWriter.class.getName());

    private final TxContext txContext;
    private final TicketEventStore eventStore;
    private final WriterHook writerHook;
    private final MetricsExporter metrics;

    /**
     * Creates a writer without a hook; events are only reachable through catch-up reads.
     */
    public TicketEventWriter(TxContext txContext, TicketEventStore eventStore) {
        this(txContext, eventStore, WriterHook.NOOP, MetricsExporter.NOOP);
    }

    /**
     * @param txContext  transaction context supplying the connection and commit callbacks
     * @param eventStore event log persistence
     * @param writerHook lifecycle hook; {@code null} defaults to {@link WriterHook#NOOP}
     * @param metrics    metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     */
    public TicketEventWriter(
            TxContext txContext,
            TicketEventStore eventStore,
            WriterHook writerHook,
            MetricsExporter metrics
    ) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.writerHook = writerHook == null ? WriterHook.NOOP : writerHook;
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Appends one event within the current transaction.
     *
     * @param event the event to persist
     * @return the event with its generated id; it is visible to others only once the
     * transaction commits
     * @throws IllegalStateException if no transaction is active
     */
    public TicketEvent append(NewTicketEvent event) {
        Objects.requireNonNull(event, "event");
        return appendAll(List.of(event)).get(0);
    }

    /**
     * Appends several events in order within the current transaction.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public List<TicketEvent> appendAll(List<NewTicketEvent> events) {
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }

        Connection conn = txContext.currentConnection();
        List<TicketEvent> appended = new ArrayList<>(events.size());
        for (NewTicketEvent event : events) {
            TicketEvent stored = eventStore.append(conn, event);
            appended.add(stored);
            runSafely("afterAppend", stored, () -> writerHook.afterAppend(stored));
        }
        List<TicketEvent> committed = List.copyOf(appended);

        txContext.afterCommit(() -> {
            for (TicketEvent event : committed) {
                metrics.incrementEventsCommitted();
                runSafely("afterCommit", event, () -> writerHook.afterCommit(event));
            }
        });
        if (writerHook != WriterHook.NOOP) {
            txContext.afterRollback(() -> {
                for (TicketEvent event : committed) {
                    runSafely("afterRollback", event, () -> writerHook.afterRollback(event));
                }
            });
        }
        return committed;
    }

    private void runSafely(String phase, TicketEvent event, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "WriterHook." + phase + " failed for eventId=" + event.id(), ex);
        }
    }
}
