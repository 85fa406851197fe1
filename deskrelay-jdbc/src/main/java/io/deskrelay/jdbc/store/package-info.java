/**
 * JDBC store implementations.
 *
 * <p>{@link io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore} holds the shared
 * event log SQL; {@link io.deskrelay.jdbc.store.H2TicketEventStore} and
 * {@link io.deskrelay.jdbc.store.PostgresTicketEventStore} differ in how the
 * generated id is returned. Ticket and comment rows use portable SQL.
 *
 * @see io.deskrelay.jdbc.store.JdbcTicketEventStores
 */
package io.deskrelay.jdbc.store;
