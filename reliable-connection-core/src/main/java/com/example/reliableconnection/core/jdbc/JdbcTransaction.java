package com.example.reliableconnection.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.reliableconnection.core.spi.DbConnection;
import com.example.reliableconnection.core.spi.DbTransaction;
import com.example.reliableconnection.core.spi.IsolationLevel;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction on one physical JDBC connection. Begins by switching auto-commit off and ends by
 * restoring the auto-commit and isolation settings found at the start.
 */
final class JdbcTransaction implements DbTransaction {

  private static final System.Logger LOGGER = System.getLogger(JdbcTransaction.class.getName());

  private final JdbcConnection owner;
  private final Connection physical;
  private final IsolationLevel isolationLevel;
  private final boolean previousAutoCommit;
  private final int previousIsolation;
  private boolean completed;
  private boolean closed;

  private JdbcTransaction(
      final JdbcConnection owner,
      final Connection physical,
      final IsolationLevel isolationLevel,
      final boolean previousAutoCommit,
      final int previousIsolation) {
    this.owner = owner;
    this.physical = physical;
    this.isolationLevel = isolationLevel;
    this.previousAutoCommit = previousAutoCommit;
    this.previousIsolation = previousIsolation;
  }

  static JdbcTransaction begin(
      final JdbcConnection owner, final Connection physical, final IsolationLevel requested)
      throws SQLException {
    final var previousAutoCommit = physical.getAutoCommit();
    final var previousIsolation = physical.getTransactionIsolation();

    if (requested != IsolationLevel.UNSPECIFIED)
      physical.setTransactionIsolation(requested.jdbcLevel());
    physical.setAutoCommit(false);

    final var effective =
        requested == IsolationLevel.UNSPECIFIED
            ? IsolationLevel.fromJdbc(previousIsolation)
            : requested;
    LOGGER.log(DEBUG, "Transaction started with isolation {0}", effective);
    return new JdbcTransaction(owner, physical, effective, previousAutoCommit, previousIsolation);
  }

  @Override
  public DbConnection getConnection() {
    return owner;
  }

  @Override
  public IsolationLevel getIsolationLevel() {
    return isolationLevel;
  }

  @Override
  public void commit() throws SQLException {
    requireActive();
    physical.commit();
    completed = true;
  }

  @Override
  public void rollback() throws SQLException {
    requireActive();
    physical.rollback();
    completed = true;
  }

  /**
   * Rolls back uncommitted work and restores the connection settings. Nothing is sent when the
   * physical connection has already been released.
   */
  @Override
  public void close() throws SQLException {
    if (closed) return;
    closed = true;
    if (physical.isClosed()) return;

    try {
      if (!completed) {
        LOGGER.log(DEBUG, "Rolling back uncompleted transaction");
        physical.rollback();
      }
    } finally {
      physical.setAutoCommit(previousAutoCommit);
      if (physical.getTransactionIsolation() != previousIsolation)
        physical.setTransactionIsolation(previousIsolation);
    }
  }

  /** Returns true while the transaction can still run statements on {@code connection}. */
  boolean isActiveOn(final Connection connection) {
    return !completed && !closed && physical == connection;
  }

  private void requireActive() {
    if (completed || closed)
      throw new IllegalStateException("This transaction has completed and is no longer usable");
  }
}
