package com.example.reliableconnection.core;

import com.example.reliableconnection.core.retry.RetryStrategy;
import com.example.reliableconnection.core.spi.CommandBehavior;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.ResettableParameterValue;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Command created by a {@link ReliableConnection}. Every execute runs under the connection's
 * {@link RetryStrategy} with this command as context.
 *
 * <p>Each attempt first resets parameter values implementing {@link ResettableParameterValue}, then
 * reopens the connection if a previous attempt left it closed, and only then calls the inner
 * command.
 */
public final class ReliableCommand extends WrappedCommand {

  private final RetryStrategy retryStrategy;

  ReliableCommand(
      final ReliableConnection connection,
      final DbCommand inner,
      final RetryStrategy retryStrategy) {
    super(connection, inner);
    this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy");
  }

  @Override
  public ReliableConnection getConnection() {
    return (ReliableConnection) super.getConnection();
  }

  @Override
  public int executeNonQuery() throws SQLException {
    return retryStrategy.executeWithRetry(
        this,
        () -> {
          prepareAttempt();
          return getInnerCommand().executeNonQuery();
        });
  }

  @Override
  public ResultSet executeReader(final CommandBehavior behavior) throws SQLException {
    return retryStrategy.executeWithRetry(
        this,
        () -> {
          prepareAttempt();
          return getInnerCommand().executeReader(behavior);
        });
  }

  @Override
  public Object executeScalar() throws SQLException {
    return retryStrategy.executeWithRetry(
        this,
        () -> {
          prepareAttempt();
          return getInnerCommand().executeScalar();
        });
  }

  @Override
  public void prepare() throws SQLException {
    retryStrategy.executeWithRetry(
        this,
        () -> {
          prepareAttempt();
          getInnerCommand().prepare();
          return null;
        });
  }

  @Override
  public CompletableFuture<Integer> executeNonQueryAsync() {
    return retryStrategy.executeWithRetryAsync(
        this,
        () -> {
          resetParameters();
          return getConnection()
              .ensureOpenAsync()
              .thenCompose(opened -> getInnerCommand().executeNonQueryAsync());
        });
  }

  @Override
  public CompletableFuture<ResultSet> executeReaderAsync(final CommandBehavior behavior) {
    return retryStrategy.executeWithRetryAsync(
        this,
        () -> {
          resetParameters();
          return getConnection()
              .ensureOpenAsync()
              .thenCompose(opened -> getInnerCommand().executeReaderAsync(behavior));
        });
  }

  @Override
  public CompletableFuture<Object> executeScalarAsync() {
    return retryStrategy.executeWithRetryAsync(
        this,
        () -> {
          resetParameters();
          return getConnection()
              .ensureOpenAsync()
              .thenCompose(opened -> getInnerCommand().executeScalarAsync());
        });
  }

  private void prepareAttempt() throws SQLException {
    resetParameters();
    getConnection().ensureOpen();
  }

  // single-pass values must start from the beginning on every attempt
  private void resetParameters() {
    for (final var parameter : getParameters())
      if (parameter.getValue() instanceof ResettableParameterValue)
        ((ResettableParameterValue) parameter.getValue()).reset();
  }
}
