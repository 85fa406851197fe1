package io.deskrelay.spring;

import io.deskrelay.TransactionFailedException;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.spi.TransactionalWork;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TransactionRunner} backed by a Spring {@link PlatformTransactionManager}.
 *
 * <p>Work runs through a {@link TransactionTemplate} with the default
 * {@code PROPAGATION_REQUIRED}: called inside an existing Spring transaction, it joins
 * that transaction and commits with it. The connection handed to the work is the
 * transaction-bound one from {@link DataSourceUtils}; the work must not close it.
 *
 * <p>Use together with {@link SpringTxContext} over the same {@link DataSource}.
 */
public final class SpringTransactionRunner implements TransactionRunner {
    private final DataSource dataSource;
    private final TransactionTemplate transactionTemplate;

    public SpringTransactionRunner(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.transactionTemplate = new TransactionTemplate(
                Objects.requireNonNull(transactionManager, "transactionManager"));
    }

    @Override
    public <T> T inTransaction(TransactionalWork<T> work) {
        Objects.requireNonNull(work, "work");
        try {
            return transactionTemplate.execute(status -> {
                Connection conn = DataSourceUtils.getConnection(dataSource);
                try {
                    return work.execute(conn);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CheckedWorkFailure(e);
                }
            });
        } catch (CheckedWorkFailure e) {
            throw new TransactionFailedException("Transactional work failed", e.getCause());
        } catch (TransactionException e) {
            throw new TransactionFailedException("Transaction failed: " + e.getMessage(), e);
        }
    }

    /** Carries a checked exception out of the template so it triggers rollback. */
    private static final class CheckedWorkFailure extends RuntimeException {
        CheckedWorkFailure(Exception cause) {
            super(cause);
        }
    }
}
