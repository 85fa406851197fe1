/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.deskrelay.jdbc.tx.JdbcTransactionManager} implements
 * {@link io.deskrelay.spi.TransactionRunner} on top of
 * {@link io.deskrelay.jdbc.tx.ThreadLocalTxContext}.
 */
package io.deskrelay.jdbc.tx;
