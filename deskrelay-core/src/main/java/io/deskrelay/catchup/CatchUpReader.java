package io.deskrelay.catchup;

import io.deskrelay.DeskRelayStoreException;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.spi.ConnectionProvider;
import io.deskrelay.spi.TicketEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Cursor-based reads of a ticket's event log.
 *
 * <p>The live hub gives no delivery guarantee; this reader is the ground truth.
 * Clients resynchronize on reconnect, or whenever they suspect a gap, by reading
 * from the id of the last event they processed.
 *
 * <p>The requested limit is clamped to {@link #MAX_LIMIT} whatever the caller asks
 * for; a non-positive limit means {@link #DEFAULT_LIMIT}.
 */
public final class CatchUpReader {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private final ConnectionProvider connectionProvider;
    private final TicketEventStore eventStore;
    private final int defaultLimit;
    private final int maxLimit;

    public CatchUpReader(ConnectionProvider connectionProvider, TicketEventStore eventStore) {
        this(connectionProvider, eventStore, DEFAULT_LIMIT, MAX_LIMIT);
    }

    /**
     * @param defaultLimit page size used when the caller passes a non-positive limit
     * @param maxLimit     hard upper bound on the page size
     */
    public CatchUpReader(ConnectionProvider connectionProvider, TicketEventStore eventStore,
                         int defaultLimit, int maxLimit) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        if (maxLimit <= 0) {
            throw new IllegalArgumentException("maxLimit must be > 0");
        }
        if (defaultLimit <= 0 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException("defaultLimit must be in 1.." + maxLimit);
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Returns the events of a ticket after {@code afterId}, oldest first.
     *
     * @param ticketId the ticket
     * @param afterId  exclusive cursor, {@code 0} to start from the beginning
     * @param limit    requested page size
     * @throws IllegalArgumentException if {@code afterId} is negative
     * @throws DeskRelayStoreException  if the log cannot be read
     */
    public EventPage read(long ticketId, long afterId, int limit) {
        if (afterId < 0) {
            throw new IllegalArgumentException("afterId must be >= 0");
        }
        int effectiveLimit = effectiveLimit(limit);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            List<TicketEvent> events = eventStore.listByTicket(conn, ticketId, afterId, effectiveLimit);
            return EventPage.of(events);
        } catch (SQLException e) {
            throw new DeskRelayStoreException("Failed to read events for ticket " + ticketId, e);
        }
    }

    /**
     * Reads the first page of a ticket's log with the default page size.
     */
    public EventPage read(long ticketId) {
        return read(ticketId, 0, defaultLimit);
    }

    int effectiveLimit(int requested) {
        if (requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }
}
