package com.example.reliableconnection.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.reliableconnection.core.spi.ConnectionState;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.DbConnection;
import com.example.reliableconnection.core.spi.DbTransaction;
import com.example.reliableconnection.core.spi.IsolationLevel;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards every call to an inner {@link DbConnection} and keeps track of the connection's current
 * transaction.
 *
 * <p>A transaction becomes current in one of two ways:
 *
 * <ul>
 *   <li>{@link #beginAutoTransaction(IsolationLevel)} begins one that this connection owns. Closing
 *       the connection closes it, rolling back uncommitted work.
 *   <li>{@link #enlistTransaction(DbTransaction)} adopts one the caller owns. This connection never
 *       commits, rolls back or closes it on its own.
 * </ul>
 *
 * <p>The connection also acts as a {@link DbTransaction} for its current transaction, so it can be
 * used directly in a try-with-resources block:
 *
 * <pre>{@code
 * try (var tx = new WrappedConnection(inner).beginAutoTransaction()) {
 *   try (var command = tx.createCommand()) {
 *     command.setCommandText("DELETE FROM sessions WHERE expired");
 *     command.executeNonQuery();
 *   }
 *   tx.commit();
 * }
 * }</pre>
 *
 * <p>Instances are meant for one caller at a time.
 */
public class WrappedConnection implements DbConnection, DbTransaction {

  private static final System.Logger LOGGER = System.getLogger(WrappedConnection.class.getName());

  private final DbConnection inner;
  private DbTransaction transaction;
  private boolean ownedTransaction;
  private boolean closed;

  public WrappedConnection(final DbConnection inner) {
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  public DbConnection getInnerConnection() {
    return inner;
  }

  public Optional<DbTransaction> currentTransaction() {
    return Optional.ofNullable(transaction);
  }

  /** Returns true when the current transaction was begun by {@link #beginAutoTransaction}. */
  public boolean isOwnedTransaction() {
    return transaction != null && ownedTransaction;
  }

  boolean ownsTransaction(final DbTransaction candidate) {
    return candidate != null && candidate == transaction && ownedTransaction;
  }

  @Override
  public void open() throws SQLException {
    inner.open();
  }

  @Override
  public CompletableFuture<Void> openAsync() {
    return inner.openAsync();
  }

  @Override
  public void disconnect() throws SQLException {
    inner.disconnect();
  }

  /**
   * Opens the inner connection unless it is already open. A broken connection is released first.
   *
   * @throws SQLException if the connection cannot be opened
   */
  public void ensureOpen() throws SQLException {
    final var state = inner.getState();
    if (state == ConnectionState.OPEN) return;
    if (state == ConnectionState.BROKEN) inner.disconnect();
    inner.open();
  }

  /**
   * Asynchronous variant of {@link #ensureOpen()}.
   *
   * @return a future completed once the inner connection is open
   */
  public CompletableFuture<Void> ensureOpenAsync() {
    final var state = inner.getState();
    if (state == ConnectionState.OPEN) return CompletableFuture.completedFuture(null);
    if (state == ConnectionState.BROKEN) {
      try {
        inner.disconnect();
      } catch (final SQLException e) {
        return CompletableFuture.failedFuture(e);
      }
    }
    return inner.openAsync();
  }

  /**
   * Creates a command bound to the current transaction, if any.
   *
   * @return the new command
   * @throws SQLException if the inner connection cannot create a command
   */
  @Override
  public WrappedCommand createCommand() throws SQLException {
    final var command = newCommand(inner.createCommand());
    try {
      if (transaction != null) command.setTransaction(transaction);
      return command;
    } catch (final RuntimeException e) {
      try {
        command.close();
      } catch (final SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  /**
   * Wraps a command created by the inner connection.
   *
   * @param innerCommand the command to wrap
   * @return the wrapper handed to callers
   */
  protected WrappedCommand newCommand(final DbCommand innerCommand) {
    return new WrappedCommand(this, innerCommand);
  }

  /** Begins a transaction on the inner connection. The caller owns and must close it. */
  @Override
  public DbTransaction beginTransaction(final IsolationLevel isolationLevel) throws SQLException {
    return inner.beginTransaction(isolationLevel);
  }

  public WrappedConnection beginAutoTransaction() throws SQLException {
    return beginAutoTransaction(IsolationLevel.UNSPECIFIED);
  }

  /**
   * Begins a transaction owned by this connection and binds it to every command created afterwards.
   *
   * @param isolationLevel requested isolation
   * @return this connection
   * @throws SQLException if the transaction cannot be started
   * @throws IllegalStateException if a transaction is already current
   */
  public WrappedConnection beginAutoTransaction(final IsolationLevel isolationLevel)
      throws SQLException {
    requireNoTransaction();
    transaction = inner.beginTransaction(isolationLevel);
    ownedTransaction = true;
    LOGGER.log(DEBUG, "Began owned transaction with isolation {0}", isolationLevel);
    return this;
  }

  /**
   * Binds a caller-owned transaction to every command created afterwards.
   *
   * @param callerTransaction the transaction, which stays under the caller's control
   * @return this connection
   * @throws IllegalStateException if a transaction is already current
   */
  public WrappedConnection enlistTransaction(final DbTransaction callerTransaction) {
    Objects.requireNonNull(callerTransaction, "callerTransaction");
    requireNoTransaction();
    transaction = callerTransaction;
    ownedTransaction = false;
    LOGGER.log(DEBUG, "Enlisted caller transaction");
    return this;
  }

  @Override
  public DbConnection getConnection() {
    return this;
  }

  @Override
  public IsolationLevel getIsolationLevel() {
    return requireTransaction().getIsolationLevel();
  }

  @Override
  public void commit() throws SQLException {
    requireTransaction().commit();
  }

  @Override
  public void rollback() throws SQLException {
    requireTransaction().rollback();
  }

  @Override
  public boolean survivesReconnect() {
    return requireTransaction().survivesReconnect();
  }

  /**
   * Closes an owned transaction, then the inner connection. An enlisted transaction is left alone.
   * Calling this more than once has no further effect.
   *
   * @throws SQLException the first failure; later ones are suppressed into it
   */
  @Override
  public void close() throws SQLException {
    if (closed) return;
    closed = true;

    final var current = transaction;
    final var owned = ownedTransaction;
    transaction = null;
    ownedTransaction = false;

    SQLException failure = null;
    if (current != null && owned) {
      try {
        current.close();
      } catch (final SQLException e) {
        failure = e;
      }
    }

    try {
      inner.close();
    } catch (final SQLException e) {
      if (failure == null) failure = e;
      else failure.addSuppressed(e);
    }

    if (failure != null) throw failure;
  }

  @Override
  public ConnectionState getState() {
    return inner.getState();
  }

  @Override
  public String getConnectionString() {
    return inner.getConnectionString();
  }

  @Override
  public void setConnectionString(final String connectionString) {
    inner.setConnectionString(connectionString);
  }

  @Override
  public String getDatabase() throws SQLException {
    return inner.getDatabase();
  }

  @Override
  public void changeDatabase(final String database) throws SQLException {
    inner.changeDatabase(database);
  }

  @Override
  public <T> T unwrap(final Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    return inner.unwrap(iface);
  }

  private DbTransaction requireTransaction() {
    if (transaction == null) throw new NoTransactionException();
    return transaction;
  }

  private void requireNoTransaction() {
    if (transaction != null)
      throw new IllegalStateException("A transaction is already active on this connection");
  }
}
