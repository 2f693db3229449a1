package com.example.reliableconnection.core.spi;

/**
 * A parameter value that can only be read once per execution, such as a stream or a cursor over
 * rows, and must be rewound before the command is executed again.
 *
 * <p>Retrying decorators call {@link #reset()} before every attempt, including the first.
 */
@FunctionalInterface
public interface ResettableParameterValue {

  /** Rewinds the value so the next execution reads it from the beginning. */
  void reset();
}
