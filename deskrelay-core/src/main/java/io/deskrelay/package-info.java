/**
 * Root API of deskrelay: transactional ticket event log plus real-time fan-out
 * to connected clients.
 *
 * <h2>Core Design</h2>
 * <p>Every ticket mutation runs in one transaction through a
 * {@link io.deskrelay.spi.TransactionRunner}: the ticket row is written, a snapshot
 * is taken, and a {@link io.deskrelay.event.TicketEvent} is appended by the
 * {@link io.deskrelay.TicketEventWriter}. After commit the
 * {@link io.deskrelay.hub.HubWriterHook} offers the event to the
 * {@linkplain io.deskrelay.hub.SubscriptionHub subscription hub}, which pushes it to
 * every session subscribed to that ticket.
 *
 * <p>Live delivery is best effort. A full dispatch queue drops the event and a full
 * session queue evicts the session. Clients recover by reading the log through
 * the {@linkplain io.deskrelay.catchup.CatchUpReader catch-up reader} from the id
 * of the last event they processed.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>deskrelay-core</b>: aggregate, writer, hub, sessions, catch-up, services</li>
 *   <li><b>deskrelay-jdbc</b>: JDBC stores (H2, PostgreSQL) and manual transactions</li>
 *   <li><b>deskrelay-micrometer</b>: Micrometer metrics</li>
 *   <li><b>deskrelay-spring-adapter</b> / <b>deskrelay-spring-boot-starter</b>: Spring integration</li>
 * </ul>
 *
 * <h2>Manual Wiring</h2>
 * <pre>{@code
 * var connections = new DataSourceConnectionProvider(dataSource);
 * var txContext   = new ThreadLocalTxContext();
 * var txManager   = new JdbcTransactionManager(connections, txContext);
 * var eventStore  = JdbcTicketEventStores.detect(dataSource);
 *
 * var hub     = SubscriptionHub.builder().build();
 * var writer  = new TicketEventWriter(txContext, eventStore, new HubWriterHook(hub), null);
 * var tickets = TicketService.builder()
 *     .transactionRunner(txManager)
 *     .ticketStore(new JdbcTicketStore())
 *     .eventWriter(writer)
 *     .catchUpReader(new CatchUpReader(connections, eventStore))
 *     .authorizer(authorizer)
 *     .build();
 *
 * Ticket ticket = tickets.create(requesterId, new NewTicket("Printer down", "", "HIGH", requesterId));
 * }</pre>
 */
package io.deskrelay;
