package io.deskrelay.jdbc.tx;

import io.deskrelay.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>Used with {@link JdbcTransactionManager}, which binds the connection and runs the
 * completion callbacks. A callback that throws is logged and does not stop the others;
 * the transaction outcome is already decided when callbacks run.
 *
 * @see JdbcTransactionManager
 * @see TxContext
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return requireState().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    requireState().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    requireState().afterRollback.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  void clearAfterCommit() {
    clear(true);
  }

  void clearAfterRollback() {
    clear(false);
  }

  private void clear(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    try {
      List<Runnable> callbacks = committed ? current.afterCommit : current.afterRollback;
      for (Runnable callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          logger.log(Level.WARNING,
              "After-" + (committed ? "commit" : "rollback") + " callback failed", e);
        }
      }
    } finally {
      state.remove();
    }
  }

  private TxState requireState() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
