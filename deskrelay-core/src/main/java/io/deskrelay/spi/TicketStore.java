package io.deskrelay.spi;

import io.deskrelay.ticket.Ticket;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence for ticket rows.
 *
 * @see TicketEventStore
 */
public interface TicketStore {

    /**
     * Inserts a new ticket.
     *
     * @return the ticket carrying its generated id
     */
    Ticket insert(Connection conn, Ticket ticket);

    /**
     * Writes the mutable columns (status, assignee, timestamps) of an existing ticket.
     *
     * @throws io.deskrelay.ticket.TicketNotFoundException if no row was updated
     */
    void update(Connection conn, Ticket ticket);

    Optional<Ticket> findById(Connection conn, long ticketId);

    /**
     * Loads a ticket and locks its row until the transaction ends, so concurrent
     * mutations of the same ticket apply one after the other.
     */
    Optional<Ticket> findByIdForUpdate(Connection conn, long ticketId);
}
