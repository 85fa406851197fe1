package io.deskrelay.spi;

import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.event.TicketEvent;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only persistence for the ticket event log.
 *
 * <p>All methods run on the supplied connection; appends must use the connection
 * of the transaction that also writes the ticket change. There is deliberately
 * no update or delete operation.
 */
public interface TicketEventStore {

    /**
     * Inserts an event and returns it with its generated id. The id is greater
     * than the id of every previously committed event.
     */
    TicketEvent append(Connection conn, NewTicketEvent event);

    /**
     * Returns events of one ticket with {@code id > afterId}, ascending by id.
     *
     * @param afterId exclusive lower bound, {@code 0} for the beginning
     * @param limit   maximum number of rows, must be positive
     */
    List<TicketEvent> listByTicket(Connection conn, long ticketId, long afterId, int limit);

    long countByTicket(Connection conn, long ticketId);
}
