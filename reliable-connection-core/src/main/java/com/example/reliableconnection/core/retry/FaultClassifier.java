package com.example.reliableconnection.core.retry;

import java.util.function.Predicate;

/**
 * Decides whether a failure is transient, meaning the same operation has a reasonable chance of
 * succeeding if it is run again unchanged.
 *
 * <pre>{@code
 * var classifier = ProviderRegistry.defaultRegistry()
 *     .or(FaultClassifier.custom(e -> e instanceof SocketTimeoutException));
 * }</pre>
 */
@FunctionalInterface
public interface FaultClassifier {

  boolean isTransient(Throwable error);

  /** Returns a classifier that treats every failure as permanent. */
  static FaultClassifier never() {
    return error -> false;
  }

  /** Creates a classifier from a predicate. */
  static FaultClassifier custom(final Predicate<Throwable> predicate) {
    return predicate::test;
  }

  /** Combines this classifier with another using OR semantics. */
  default FaultClassifier or(final FaultClassifier other) {
    return error -> this.isTransient(error) || other.isTransient(error);
  }
}
