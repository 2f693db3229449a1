package com.example.reliableconnection.core.spi;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;

/**
 * A database connection that can be opened, disconnected and opened again.
 *
 * <p>{@link #disconnect()} releases the physical link but keeps the object usable; {@link #close()}
 * ends its life and releases everything it owns.
 */
public interface DbConnection extends AutoCloseable {

  /**
   * Opens the physical connection.
   *
   * @throws SQLException if the connection cannot be established
   * @throws IllegalStateException if the connection is already open
   */
  void open() throws SQLException;

  /**
   * Opens the physical connection without blocking the caller.
   *
   * @return a future completed once the connection is open
   */
  CompletableFuture<Void> openAsync();

  /**
   * Releases the physical connection. The connection may be opened again afterwards.
   *
   * @throws SQLException if the driver fails to close the link
   */
  void disconnect() throws SQLException;

  /** Releases the connection and every resource it owns. */
  @Override
  void close() throws SQLException;

  DbCommand createCommand() throws SQLException;

  /**
   * Begins a transaction on the open connection. The caller owns the returned transaction.
   *
   * @param isolationLevel requested isolation
   * @return the new transaction
   * @throws SQLException if the transaction cannot be started
   */
  DbTransaction beginTransaction(IsolationLevel isolationLevel) throws SQLException;

  ConnectionState getState();

  String getConnectionString();

  void setConnectionString(String connectionString);

  /**
   * Returns the current database (catalog) name.
   *
   * @return the database name, or {@code null} when the connection is not open
   * @throws SQLException on driver errors
   */
  String getDatabase() throws SQLException;

  void changeDatabase(String database) throws SQLException;

  /**
   * Returns an object that implements the given interface, either this or a wrapped delegate.
   *
   * @param iface the requested interface
   * @param <T> the requested type
   * @return the object implementing {@code iface}
   * @throws SQLException if nothing in the chain implements {@code iface}
   */
  default <T> T unwrap(final Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    throw new SQLException("Not a wrapper for " + iface.getName());
  }
}
