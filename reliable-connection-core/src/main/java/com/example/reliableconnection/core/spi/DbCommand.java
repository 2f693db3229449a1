package com.example.reliableconnection.core.spi;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A command executed against a {@link DbConnection}.
 *
 * <p>The asynchronous variants report failures through the returned future, never by throwing.
 */
public interface DbCommand extends AutoCloseable {

  String getCommandText();

  void setCommandText(String commandText);

  CommandType getCommandType();

  void setCommandType(CommandType commandType);

  /** Timeout in seconds; zero means no limit. */
  int getCommandTimeout();

  void setCommandTimeout(int seconds);

  /** Returns the live, ordered parameter list. */
  List<DbParameter> getParameters();

  DbTransaction getTransaction();

  void setTransaction(DbTransaction transaction);

  DbConnection getConnection();

  /**
   * Returns true when the bound transaction belongs to the caller rather than to the connection
   * that created this command. A plain command cannot tell the difference, so any bound
   * transaction counts as the caller's.
   *
   * @return whether a caller-owned transaction is bound
   */
  default boolean hasExternalTransaction() {
    return getTransaction() != null;
  }

  int executeNonQuery() throws SQLException;

  ResultSet executeReader(CommandBehavior behavior) throws SQLException;

  default ResultSet executeReader() throws SQLException {
    return executeReader(CommandBehavior.DEFAULT);
  }

  /**
   * Executes the command and returns the first column of the first row.
   *
   * @return the value, or {@code null} if the command returned no rows
   * @throws SQLException on database errors
   */
  Object executeScalar() throws SQLException;

  void prepare() throws SQLException;

  CompletableFuture<Integer> executeNonQueryAsync();

  CompletableFuture<ResultSet> executeReaderAsync(CommandBehavior behavior);

  default CompletableFuture<ResultSet> executeReaderAsync() {
    return executeReaderAsync(CommandBehavior.DEFAULT);
  }

  CompletableFuture<Object> executeScalarAsync();

  void cancel() throws SQLException;

  @Override
  void close() throws SQLException;
}
