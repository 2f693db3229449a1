package com.example.reliableconnection.core.retry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.reliableconnection.core.provider.ProviderRegistry;
import com.example.reliableconnection.core.spi.ConnectionState;
import com.example.reliableconnection.core.spi.DbCommand;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link RetryStrategy}: applies a {@link RetryPolicy} and asks a {@link FaultClassifier}
 * which failures are worth retrying.
 *
 * <p>A failure is retried only if all of the following hold, checked in this order:
 *
 * <ol>
 *   <li>the classifier reports it as transient;
 *   <li>the policy still allows another retry;
 *   <li>the policy's listener does not cancel the retry;
 *   <li>the command context is not bound to a transaction owned by the caller;
 *   <li>any transaction bound to the command context {@linkplain
 *       com.example.reliableconnection.core.spi.DbTransaction#survivesReconnect() survives a
 *       reconnect}.
 * </ol>
 *
 * <p>Otherwise the failure is propagated unchanged. Before retrying a command, its connection is
 * disconnected so the next attempt reopens it.
 *
 * <pre>{@code
 * var executor = new RetryExecutor(RetryPolicy.builder().maxRetryCount(3).build());
 * int rows = executor.executeWithRetry(null, () -> insertOrder(order));
 * }</pre>
 */
public final class RetryExecutor implements RetryStrategy {

  private static final System.Logger LOGGER = System.getLogger(RetryExecutor.class.getName());

  private final RetryPolicy policy;
  private final FaultClassifier classifier;
  private final Sleeper sleeper;
  private final DelayScheduler scheduler;

  /**
   * Creates an executor that classifies failures with {@link ProviderRegistry#defaultRegistry()}.
   *
   * @param policy the retry policy
   */
  public RetryExecutor(final RetryPolicy policy) {
    this(policy, ProviderRegistry.defaultRegistry());
  }

  public RetryExecutor(final RetryPolicy policy, final FaultClassifier classifier) {
    this(policy, classifier, Sleeper.THREAD, DelayScheduler.DEFAULT);
  }

  private RetryExecutor(
      final RetryPolicy policy,
      final FaultClassifier classifier,
      final Sleeper sleeper,
      final DelayScheduler scheduler) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy policy() {
    return policy;
  }

  public FaultClassifier classifier() {
    return classifier;
  }

  @Override
  public <T> T executeWithRetry(final DbCommand commandContext, final SqlOperation<T> operation)
      throws SQLException {
    Objects.requireNonNull(operation, "operation");

    var attempt = 0;
    var delay = policy.minBackoff();

    while (true) {
      try {
        return operation.get();
      } catch (final SQLException | RuntimeException e) {
        if (!isRetryable(commandContext, e, attempt)) throw e;

        try {
          ensureClosed(commandContext);
        } catch (final SQLException closeFailure) {
          e.addSuppressed(closeFailure);
          throw e;
        }

        final var wait = policy.delayFor(attempt, delay);
        if (!wait.isZero()) {
          try {
            sleeper.sleep(wait);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }

        delay = policy.nextDelay(attempt, delay);
        attempt++;
      }
    }
  }

  @Override
  public <T> CompletableFuture<T> executeWithRetryAsync(
      final DbCommand commandContext, final AsyncOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");

    final var result = new CompletableFuture<T>();
    attemptAsync(commandContext, operation, result, 0, policy.minBackoff());
    return result;
  }

  private <T> void attemptAsync(
      final DbCommand commandContext,
      final AsyncOperation<T> operation,
      final CompletableFuture<T> result,
      final int attempt,
      final Duration delay) {
    // cancelled by the caller while a retry was pending
    if (result.isDone()) return;

    final CompletableFuture<T> pending;
    try {
      pending = operation.start();
    } catch (final SQLException | RuntimeException e) {
      result.completeExceptionally(e);
      return;
    }
    if (pending == null) {
      result.completeExceptionally(new IllegalStateException("operation returned a null future"));
      return;
    }

    pending.whenComplete(
        (value, failure) -> {
          try {
            if (failure == null) {
              result.complete(value);
              return;
            }

            final var error = unwrap(failure);
            if (error instanceof CancellationException) {
              result.cancel(false);
              return;
            }

            if (!isRetryable(commandContext, error, attempt)) {
              result.completeExceptionally(error);
              return;
            }

            try {
              ensureClosed(commandContext);
            } catch (final SQLException closeFailure) {
              error.addSuppressed(closeFailure);
              result.completeExceptionally(error);
              return;
            }

            final var wait = policy.delayFor(attempt, delay);
            final var next = policy.nextDelay(attempt, delay);
            if (wait.isZero()) {
              attemptAsync(commandContext, operation, result, attempt + 1, next);
            } else {
              final var nextAttempt = attempt + 1;
              final Runnable retry =
                  () -> attemptAsync(commandContext, operation, result, nextAttempt, next);
              scheduler.after(wait).execute(retry);
            }
          } catch (final RuntimeException e) {
            // a throwing listener or a rejected schedule must still settle the caller's future
            result.completeExceptionally(e);
          }
        });
  }

  private boolean isRetryable(
      final DbCommand commandContext, final Throwable error, final int attempt) {
    if (!classifier.isTransient(error)) return false;

    if (!policy.shouldRetry(attempt)) {
      LOGGER.log(WARNING, "All {0} retries exhausted, giving up", policy.maxRetryCount());
      return false;
    }

    if (policy.listener().onRetry(new RetryEvent(error, commandContext, attempt))) {
      LOGGER.log(DEBUG, "Retry of attempt {0} cancelled by listener", attempt);
      return false;
    }

    if (commandContext != null && commandContext.hasExternalTransaction()) {
      LOGGER.log(
          WARNING, "Transient failure inside a caller-owned transaction, not retrying: {0}", error);
      return false;
    }

    final var transaction = commandContext == null ? null : commandContext.getTransaction();
    if (transaction != null && !transaction.survivesReconnect()) {
      LOGGER.log(
          WARNING,
          "Transient failure inside a transaction lost on reconnect, not retrying: {0}",
          error);
      return false;
    }

    LOGGER.log(DEBUG, "Transient failure on attempt {0}, retrying: {1}", attempt, error);
    return true;
  }

  private static void ensureClosed(final DbCommand commandContext) throws SQLException {
    if (commandContext == null) return;

    final var connection = commandContext.getConnection();
    if (connection != null && connection.getState() != ConnectionState.CLOSED)
      connection.disconnect();
  }

  private static Throwable unwrap(final Throwable failure) {
    var current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) current = current.getCause();
    return current;
  }

  /** Blocks the calling thread between synchronous attempts. */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);

    void sleep(Duration delay) throws InterruptedException;
  }

  /** Supplies one-shot executors that run a task after a delay. */
  @FunctionalInterface
  public interface DelayScheduler {
    DelayScheduler DEFAULT =
        delay -> CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS);

    Executor after(Duration delay);

    /**
     * Uses the given executor to run tasks once the delay has elapsed.
     *
     * @param executor runs the delayed tasks
     * @return scheduler backed by {@code executor}
     */
    static DelayScheduler using(final Executor executor) {
      Objects.requireNonNull(executor, "executor");
      return delay ->
          CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
    }
  }

  /** Fluent builder for {@link RetryExecutor}. */
  public static final class Builder {
    private RetryPolicy policy = RetryPolicy.defaults();
    private FaultClassifier classifier;
    private Sleeper sleeper = Sleeper.THREAD;
    private DelayScheduler scheduler = DelayScheduler.DEFAULT;

    private Builder() {}

    public Builder policy(final RetryPolicy policy) {
      this.policy = policy;
      return this;
    }

    /**
     * Sets the fault classifier.
     *
     * <p>Default: {@link ProviderRegistry#defaultRegistry()}
     *
     * @param classifier decides which failures are transient
     * @return this builder
     */
    public Builder classifier(final FaultClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets how asynchronous retries are delayed.
     *
     * <p>Default: {@link CompletableFuture#delayedExecutor} on the common pool
     *
     * @param scheduler supplies delayed executors
     * @return this builder
     */
    public Builder scheduler(final DelayScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public RetryExecutor build() {
      if (policy == null) throw new IllegalStateException("policy cannot be null");
      if (sleeper == null) throw new IllegalStateException("sleeper cannot be null");
      if (scheduler == null) throw new IllegalStateException("scheduler cannot be null");
      return new RetryExecutor(
          policy,
          classifier == null ? ProviderRegistry.defaultRegistry() : classifier,
          sleeper,
          scheduler);
    }
  }
}
