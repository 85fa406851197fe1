package io.deskrelay.jdbc.tx;

import io.deskrelay.TransactionFailedException;
import io.deskrelay.spi.ConnectionProvider;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.spi.TransactionalWork;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for manual JDBC usage. Obtains a connection, disables
 * auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Most callers use {@link #inTransaction}:
 * <pre>{@code
 * Ticket ticket = txManager.inTransaction(conn -> {
 *     Ticket stored = ticketStore.insert(conn, opened);
 *     writer.append(new NewTicketEvent(stored.id(), EventType.TICKET_CREATED, payload, actor, now));
 *     return stored;
 * });
 * }</pre>
 *
 * <p>{@link #begin()} exposes the lower-level handle for try-with-resources use.
 * Transactions do not nest: beginning one while another is bound to the thread fails.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager implements TransactionRunner {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Runs {@code work} in a new transaction and commits if it returns normally.
   *
   * @throws TransactionFailedException if the transaction cannot begin or commit, or the
   *                                    work throws a checked exception
   * @throws IllegalStateException      if a transaction is already active on this thread
   */
  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    Transaction tx;
    try {
      tx = begin();
    } catch (SQLException e) {
      throw new TransactionFailedException("Failed to begin transaction", e);
    }

    T result;
    try {
      result = work.execute(tx.connection);
    } catch (RuntimeException | Error e) {
      tx.rollbackAfter(e);
      throw e;
    } catch (Exception e) {
      tx.rollbackAfter(e);
      throw new TransactionFailedException("Transactional work failed", e);
    }

    try {
      tx.commit();
    } catch (SQLException e) {
      throw new TransactionFailedException("Failed to commit transaction", e);
    }
    return result;
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException          if a connection cannot be obtained or configured
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      closeAfter(connection, e);
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  private static void closeAfter(Connection connection, Exception failure) {
    try {
      connection.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        rollbackAfter(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void rollbackAfter(Throwable failure) {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure.addSuppressed(e);
      } finally {
        finalizeTx(false);
      }
    }

    private void finalizeTx(boolean committed) {
      if (completed) {
        return;
      }
      completed = true;
      try {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      } finally {
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
        try {
          connection.close();
        } catch (SQLException e) {
          logger.log(Level.WARNING, "Failed to close transaction connection", e);
        }
      }
    }
  }
}
