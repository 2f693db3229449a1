package com.example.reliableconnection.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.reliableconnection.core.provider.ProviderRegistry;
import com.example.reliableconnection.core.retry.FaultClassifier;
import com.example.reliableconnection.core.retry.RetryEvent;
import com.example.reliableconnection.core.retry.RetryPolicy;
import java.util.Objects;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Applies a {@link RetryPolicy} to Reactor pipelines.
 *
 * <p>The produced {@link Retry} makes the same decisions as {@link
 * com.example.reliableconnection.core.retry.RetryExecutor}: a failure is resubscribed only if the
 * classifier reports it as transient, the policy allows another retry and the listener does not
 * cancel. Waits follow {@link RetryPolicy#backoffBefore(int)}.
 *
 * <pre>{@code
 * Mono.from(connection.createStatement("SELECT 1").execute())
 *     .retryWhen(ReactiveRetry.from(RetryPolicy.defaults(), ProviderRegistry.defaultRegistry()));
 * }</pre>
 *
 * <p>Listeners receive a {@code null} command context.
 */
public final class ReactiveRetry {

  private static final System.Logger LOGGER = System.getLogger(ReactiveRetry.class.getName());

  private ReactiveRetry() {}

  public static Retry from(final RetryPolicy policy, final FaultClassifier classifier) {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(classifier, "classifier");

    return Retry.from(
        signals ->
            signals.concatMap(
                signal -> {
                  final var error = signal.failure();
                  final var attempt = (int) signal.totalRetries();

                  if (!classifier.isTransient(error)) return Mono.error(error);

                  if (!policy.shouldRetry(attempt)) {
                    LOGGER.log(
                        WARNING, "All {0} retries exhausted, giving up", policy.maxRetryCount());
                    return Mono.error(error);
                  }

                  if (policy.listener().onRetry(new RetryEvent(error, null, attempt))) {
                    LOGGER.log(DEBUG, "Retry of attempt {0} cancelled by listener", attempt);
                    return Mono.error(error);
                  }

                  final var wait = policy.backoffBefore(attempt);
                  LOGGER.log(
                      DEBUG,
                      "Transient error on attempt {0}, retrying in {1}ms: {2}",
                      attempt,
                      wait.toMillis(),
                      error);
                  return wait.isZero() ? Mono.just(attempt) : Mono.delay(wait).thenReturn(attempt);
                }));
  }

  /**
   * Retries {@code source} with the given policy, classifying failures with {@link
   * ProviderRegistry#defaultRegistry()}.
   *
   * @param source the publisher to resubscribe on transient failures
   * @param policy the retry policy
   * @param <T> element type
   * @return the retrying publisher
   */
  public static <T> Mono<T> withRetry(final Mono<T> source, final RetryPolicy policy) {
    return withRetry(source, policy, ProviderRegistry.defaultRegistry());
  }

  public static <T> Mono<T> withRetry(
      final Mono<T> source, final RetryPolicy policy, final FaultClassifier classifier) {
    return source.retryWhen(from(policy, classifier));
  }
}
