package com.example.reliableconnection.core.retry;

import com.example.reliableconnection.core.spi.DbCommand;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;

/** Runs database operations and retries them when a transient failure is detected. */
public interface RetryStrategy {

  /**
   * Runs the operation, retrying it on transient failures.
   *
   * @param commandContext the command the operation executes, or {@code null} when the operation
   *     works directly on a connection
   * @param operation the work to run
   * @param <T> result type
   * @return the operation's result
   * @throws SQLException the failure of the last attempt, unchanged
   */
  <T> T executeWithRetry(DbCommand commandContext, SqlOperation<T> operation) throws SQLException;

  /**
   * Runs an asynchronous operation, retrying it on transient failures without blocking a thread
   * between attempts.
   *
   * @param commandContext the command the operation executes, or {@code null}
   * @param operation starts one attempt
   * @param <T> result type
   * @return a future completed exactly once with the final outcome
   */
  <T> CompletableFuture<T> executeWithRetryAsync(
      DbCommand commandContext, AsyncOperation<T> operation);

  /**
   * Synchronous unit of work that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface SqlOperation<T> {
    T get() throws SQLException;
  }

  /**
   * Starts one asynchronous attempt.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface AsyncOperation<T> {
    CompletableFuture<T> start() throws SQLException;
  }
}
