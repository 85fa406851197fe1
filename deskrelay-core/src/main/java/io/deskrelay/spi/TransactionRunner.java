package io.deskrelay.spi;

/**
 * Runs a unit of work as one atomic transaction.
 *
 * <p>The work commits only if it returns normally. Any exception rolls back every
 * write it made, including event appends, and the caller observes that single
 * failure: unchecked exceptions are rethrown as is, checked ones wrapped in
 * {@link io.deskrelay.TransactionFailedException}. A failure to begin or commit
 * also surfaces as {@code TransactionFailedException}; nothing is retried.
 *
 * <p>After-commit callbacks registered through {@link TxContext} run after the
 * commit and before this method returns.
 */
public interface TransactionRunner {

    <T> T inTransaction(TransactionalWork<T> work);
}
