package com.example.reliableconnection.core;

import com.example.reliableconnection.core.spi.CommandBehavior;
import com.example.reliableconnection.core.spi.CommandType;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.DbParameter;
import com.example.reliableconnection.core.spi.DbTransaction;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Forwards every call to an inner {@link DbCommand} created by a {@link WrappedConnection}. */
public class WrappedCommand implements DbCommand {

  private final WrappedConnection connection;
  private final DbCommand inner;

  public WrappedCommand(final WrappedConnection connection, final DbCommand inner) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  public DbCommand getInnerCommand() {
    return inner;
  }

  /** Returns the wrapping connection, not the inner one. */
  @Override
  public WrappedConnection getConnection() {
    return connection;
  }

  /**
   * Returns true when a transaction is bound that the owning connection did not begin itself,
   * either one it enlisted or one set directly on this command.
   */
  @Override
  public boolean hasExternalTransaction() {
    final var transaction = inner.getTransaction();
    return transaction != null && !connection.ownsTransaction(transaction);
  }

  @Override
  public String getCommandText() {
    return inner.getCommandText();
  }

  @Override
  public void setCommandText(final String commandText) {
    inner.setCommandText(commandText);
  }

  @Override
  public CommandType getCommandType() {
    return inner.getCommandType();
  }

  @Override
  public void setCommandType(final CommandType commandType) {
    inner.setCommandType(commandType);
  }

  @Override
  public int getCommandTimeout() {
    return inner.getCommandTimeout();
  }

  @Override
  public void setCommandTimeout(final int seconds) {
    inner.setCommandTimeout(seconds);
  }

  @Override
  public List<DbParameter> getParameters() {
    return inner.getParameters();
  }

  @Override
  public DbTransaction getTransaction() {
    return inner.getTransaction();
  }

  /**
   * Binds a transaction. Passing the owning connection binds its current transaction instead.
   *
   * @throws NoTransactionException if the owning connection is passed while it has no transaction
   */
  @Override
  public void setTransaction(final DbTransaction transaction) {
    if (transaction == connection)
      inner.setTransaction(
          connection.currentTransaction().orElseThrow(NoTransactionException::new));
    else inner.setTransaction(transaction);
  }

  @Override
  public int executeNonQuery() throws SQLException {
    return inner.executeNonQuery();
  }

  @Override
  public ResultSet executeReader(final CommandBehavior behavior) throws SQLException {
    return inner.executeReader(behavior);
  }

  @Override
  public Object executeScalar() throws SQLException {
    return inner.executeScalar();
  }

  @Override
  public void prepare() throws SQLException {
    inner.prepare();
  }

  @Override
  public CompletableFuture<Integer> executeNonQueryAsync() {
    return inner.executeNonQueryAsync();
  }

  @Override
  public CompletableFuture<ResultSet> executeReaderAsync(final CommandBehavior behavior) {
    return inner.executeReaderAsync(behavior);
  }

  @Override
  public CompletableFuture<Object> executeScalarAsync() {
    return inner.executeScalarAsync();
  }

  @Override
  public void cancel() throws SQLException {
    inner.cancel();
  }

  @Override
  public void close() throws SQLException {
    inner.close();
  }
}
