package io.deskrelay.spi;

import java.sql.Connection;

/**
 * A unit of work executed by {@link TransactionRunner} on the transaction's connection.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    T execute(Connection connection) throws Exception;
}
