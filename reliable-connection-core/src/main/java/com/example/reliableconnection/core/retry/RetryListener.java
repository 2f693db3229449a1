package com.example.reliableconnection.core.retry;

/**
 * Notified before each retry. Returning {@code true} cancels the retry and propagates the
 * triggering error immediately.
 *
 * <pre>{@code
 * RetryListener listener = event -> {
 *     metrics.increment("db.retry");
 *     return event.attempt() >= 2 && shuttingDown.get();
 * };
 * }</pre>
 */
@FunctionalInterface
public interface RetryListener {

  /** Listener that never cancels. */
  RetryListener NONE = event -> false;

  /**
   * Called before a retry.
   *
   * @param event the retry about to happen
   * @return true to cancel the retry
   */
  boolean onRetry(RetryEvent event);

  /**
   * Calls this listener and then {@code other}; the retry is cancelled if either cancels.
   *
   * @param other the listener to call second
   * @return the combined listener
   */
  default RetryListener andThen(final RetryListener other) {
    return event -> {
      final var cancelled = onRetry(event);
      return other.onRetry(event) || cancelled;
    };
  }
}
