package com.example.reliableconnection.core.spi;

import java.sql.SQLException;

/** A transaction begun on a {@link DbConnection}. */
public interface DbTransaction extends AutoCloseable {

  DbConnection getConnection();

  IsolationLevel getIsolationLevel();

  void commit() throws SQLException;

  void rollback() throws SQLException;

  /**
   * Returns whether the transaction stays usable after its connection is closed and reopened.
   * Retrying a command inside a transaction that does not survive would run the command outside
   * it, so such failures are not retried.
   *
   * @return false unless the implementation can carry the transaction to a new session
   */
  default boolean survivesReconnect() {
    return false;
  }

  /** Ends the transaction, rolling back any work that was not committed. */
  @Override
  void close() throws SQLException;
}
