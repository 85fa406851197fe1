/**
 * JDBC persistence for tickets, comments and the ticket event log.
 *
 * <p>{@link io.deskrelay.jdbc.JdbcTemplate} wraps statement handling and maps
 * {@link java.sql.SQLException} to {@link io.deskrelay.DeskRelayStoreException}.
 * DDL for H2 and PostgreSQL ships on the classpath as {@code schema/h2.sql} and
 * {@code schema/postgresql.sql}.
 *
 * @see io.deskrelay.jdbc.store.JdbcTicketEventStores
 * @see io.deskrelay.jdbc.tx.JdbcTransactionManager
 */
package io.deskrelay.jdbc;
