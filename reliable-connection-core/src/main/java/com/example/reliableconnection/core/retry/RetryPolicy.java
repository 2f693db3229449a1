package com.example.reliableconnection.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Retry policy with incremental backoff.
 *
 * <p>After a transient failure of attempt {@code n} (zero-based) the operation is retried while
 * {@code n < maxRetryCount}. The first retry runs immediately when {@code fastFirstRetry} is set;
 * every other retry waits for the current delay, which starts at {@code minBackoff} and grows by
 * {@code incrementalBackoff} after each wait, capped at {@code maxBackoff}.
 *
 * <h2>Defaults</h2>
 *
 * <pre>{@code
 * var policy = RetryPolicy.defaults(); // fast first retry, 10 retries, 100ms..1s by 100ms
 * }</pre>
 *
 * <h2>Custom Policy</h2>
 *
 * <pre>{@code
 * var policy = RetryPolicy.builder()
 *     .maxRetryCount(3)
 *     .minBackoff(Duration.ofMillis(250))
 *     .incrementalBackoff(Duration.ofMillis(250))
 *     .maxBackoff(Duration.ofSeconds(2))
 *     .listener(event -> {
 *         log.warn("retrying after {}", event.error().toString());
 *         return false;
 *     })
 *     .build();
 * }</pre>
 *
 * @param fastFirstRetry whether the first retry runs without waiting
 * @param maxRetryCount retries allowed after the first attempt, must be >= 0
 * @param minBackoff first wait, must be >= 0 and <= maxBackoff
 * @param maxBackoff upper bound for any wait
 * @param incrementalBackoff amount added to the wait after each retry, must be >= 0
 * @param listener notified before each retry, may cancel it
 */
public record RetryPolicy(
    boolean fastFirstRetry,
    int maxRetryCount,
    Duration minBackoff,
    Duration maxBackoff,
    Duration incrementalBackoff,
    RetryListener listener) {

  static final boolean DEFAULT_FAST_FIRST_RETRY = true;
  static final int DEFAULT_MAX_RETRY_COUNT = 10;
  static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(100);
  static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(1);
  static final Duration DEFAULT_INCREMENTAL_BACKOFF = Duration.ofMillis(100);

  public RetryPolicy {
    if (maxRetryCount < 0) throw new IllegalArgumentException("maxRetryCount must be >= 0");
    requireNonNegative(minBackoff, "minBackoff");
    requireNonNegative(maxBackoff, "maxBackoff");
    requireNonNegative(incrementalBackoff, "incrementalBackoff");
    if (minBackoff.compareTo(maxBackoff) > 0)
      throw new IllegalArgumentException("minBackoff must be <= maxBackoff");
    listener = listener == null ? RetryListener.NONE : listener;
  }

  /**
   * Returns the default policy: fast first retry, 10 retries, waits from 100ms growing by 100ms up
   * to 1 second.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return builder().build();
  }

  /**
   * Creates a builder initialised with the default values.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a policy from system properties, falling back to environment variables and then to the
   * defaults.
   *
   * <ul>
   *   <li>reliable.retry.fastFirstRetry / RELIABLE_RETRY_FAST_FIRST_RETRY
   *   <li>reliable.retry.maxRetryCount / RELIABLE_RETRY_MAX_RETRY_COUNT
   *   <li>reliable.retry.minBackoffMillis / RELIABLE_RETRY_MIN_BACKOFF_MILLIS
   *   <li>reliable.retry.maxBackoffMillis / RELIABLE_RETRY_MAX_BACKOFF_MILLIS
   *   <li>reliable.retry.incrementalBackoffMillis / RELIABLE_RETRY_INCREMENTAL_BACKOFF_MILLIS
   * </ul>
   *
   * <p>Blank or unparseable values are ignored.
   *
   * @return the configured policy
   * @throws IllegalArgumentException if the resulting combination is invalid
   */
  public static RetryPolicy fromSystemProperties() {
    final var builder = builder();
    setting("reliable.retry.fastFirstRetry", "RELIABLE_RETRY_FAST_FIRST_RETRY", Boolean::valueOf)
        .ifPresent(builder::fastFirstRetry);
    setting("reliable.retry.maxRetryCount", "RELIABLE_RETRY_MAX_RETRY_COUNT", Integer::valueOf)
        .ifPresent(builder::maxRetryCount);
    setting("reliable.retry.minBackoffMillis", "RELIABLE_RETRY_MIN_BACKOFF_MILLIS", Long::valueOf)
        .map(Duration::ofMillis)
        .ifPresent(builder::minBackoff);
    setting("reliable.retry.maxBackoffMillis", "RELIABLE_RETRY_MAX_BACKOFF_MILLIS", Long::valueOf)
        .map(Duration::ofMillis)
        .ifPresent(builder::maxBackoff);
    setting(
            "reliable.retry.incrementalBackoffMillis",
            "RELIABLE_RETRY_INCREMENTAL_BACKOFF_MILLIS",
            Long::valueOf)
        .map(Duration::ofMillis)
        .ifPresent(builder::incrementalBackoff);
    return builder.build();
  }

  /**
   * Returns whether a failed attempt may be retried.
   *
   * @param attempt the attempt that just failed, zero-based
   * @return true if {@code attempt < maxRetryCount}
   */
  public boolean shouldRetry(final int attempt) {
    return attempt < maxRetryCount;
  }

  /**
   * Returns how long to wait before retrying the attempt that just failed.
   *
   * @param attempt the attempt that just failed, zero-based
   * @param priorDelay the current delay, {@link #minBackoff()} before the first wait
   * @return zero for a fast first retry, otherwise {@code priorDelay}
   */
  public Duration delayFor(final int attempt, final Duration priorDelay) {
    return isFastRetry(attempt) ? Duration.ZERO : priorDelay;
  }

  /**
   * Returns the delay to carry into the next attempt.
   *
   * @param attempt the attempt that just failed, zero-based
   * @param priorDelay the current delay
   * @return {@code priorDelay} after a fast retry, else {@code min(priorDelay + incrementalBackoff,
   *     maxBackoff)}
   */
  public Duration nextDelay(final int attempt, final Duration priorDelay) {
    if (isFastRetry(attempt)) return priorDelay;
    final var next = priorDelay.plus(incrementalBackoff);
    return next.compareTo(maxBackoff) > 0 ? maxBackoff : next;
  }

  /**
   * Returns the wait before retrying the given failed attempt, computed without carried state.
   *
   * @param attempt the attempt that just failed, zero-based
   * @return the same value the {@link #delayFor}/{@link #nextDelay} sequence produces
   */
  public Duration backoffBefore(final int attempt) {
    if (isFastRetry(attempt)) return Duration.ZERO;
    final var waitsSoFar = fastFirstRetry ? attempt - 1 : attempt;
    final var delay = minBackoff.plus(incrementalBackoff.multipliedBy(waitsSoFar));
    return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
  }

  /**
   * Returns a copy of this policy with another listener.
   *
   * @param listener the new listener, {@code null} for none
   * @return the new policy
   */
  public RetryPolicy withListener(final RetryListener listener) {
    return toBuilder().listener(listener).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .fastFirstRetry(fastFirstRetry)
        .maxRetryCount(maxRetryCount)
        .minBackoff(minBackoff)
        .maxBackoff(maxBackoff)
        .incrementalBackoff(incrementalBackoff)
        .listener(listener);
  }

  private boolean isFastRetry(final int attempt) {
    return attempt == 0 && fastFirstRetry;
  }

  private static void requireNonNegative(final Duration value, final String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
  }

  private static <T> Optional<T> setting(
      final String property, final String env, final Function<String, T> parser) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(parser.apply(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            });
  }

  /** Fluent builder for {@link RetryPolicy}. */
  public static final class Builder {
    private boolean fastFirstRetry = DEFAULT_FAST_FIRST_RETRY;
    private int maxRetryCount = DEFAULT_MAX_RETRY_COUNT;
    private Duration minBackoff = DEFAULT_MIN_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private Duration incrementalBackoff = DEFAULT_INCREMENTAL_BACKOFF;
    private RetryListener listener = RetryListener.NONE;

    private Builder() {}

    /**
     * Sets whether the first retry runs without waiting.
     *
     * <p>Default: true
     *
     * @param fastFirstRetry true to skip the first wait
     * @return this builder
     */
    public Builder fastFirstRetry(final boolean fastFirstRetry) {
      this.fastFirstRetry = fastFirstRetry;
      return this;
    }

    /**
     * Sets the number of retries after the first attempt.
     *
     * <p>Default: 10
     *
     * @param maxRetryCount retries, 0 to disable retrying
     * @return this builder
     */
    public Builder maxRetryCount(final int maxRetryCount) {
      this.maxRetryCount = maxRetryCount;
      return this;
    }

    /**
     * Sets the first wait.
     *
     * <p>Default: 100 milliseconds
     *
     * @param minBackoff the first wait
     * @return this builder
     */
    public Builder minBackoff(final Duration minBackoff) {
      this.minBackoff = minBackoff;
      return this;
    }

    /**
     * Sets the upper bound for any wait.
     *
     * <p>Default: 1 second
     *
     * @param maxBackoff the cap
     * @return this builder
     */
    public Builder maxBackoff(final Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
      return this;
    }

    /**
     * Sets the amount added to the wait after each retry.
     *
     * <p>Default: 100 milliseconds
     *
     * @param incrementalBackoff the increment
     * @return this builder
     */
    public Builder incrementalBackoff(final Duration incrementalBackoff) {
      this.incrementalBackoff = incrementalBackoff;
      return this;
    }

    public Builder listener(final RetryListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Builds the policy.
     *
     * @return the policy
     * @throws IllegalArgumentException if the values are inconsistent
     */
    public RetryPolicy build() {
      return new RetryPolicy(
          fastFirstRetry, maxRetryCount, minBackoff, maxBackoff, incrementalBackoff, listener);
    }
  }
}
