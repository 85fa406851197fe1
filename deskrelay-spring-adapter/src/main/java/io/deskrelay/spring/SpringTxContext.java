package io.deskrelay.spring;

import io.deskrelay.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>Connections are obtained through {@link DataSourceUtils} so event appends join
 * the Spring-managed transaction. After-commit and after-rollback callbacks are
 * registered as {@link TransactionSynchronization} instances.
 *
 * <p>Requires transaction synchronization to be active (the default); with
 * {@code SYNCHRONIZATION_NEVER} every call other than {@link #isTransactionActive()}
 * throws {@link IllegalStateException}.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    public Connection currentConnection() {
        requireSynchronizationActive("obtain connection");
        return DataSourceUtils.getConnection(dataSource);
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireSynchronizationActive("register afterCommit callback");
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                callback.run();
            }
        });
    }

    @Override
    public void afterRollback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireSynchronizationActive("register afterRollback callback");
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    callback.run();
                }
            }
        });
    }

    private void requireSynchronizationActive(String operation) {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException(
                    "Transaction synchronization is not active; cannot " + operation);
        }
    }
}
