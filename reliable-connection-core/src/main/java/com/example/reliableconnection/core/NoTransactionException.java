package com.example.reliableconnection.core;

/**
 * Thrown when a transaction operation is called on a {@link WrappedConnection} that has no current
 * transaction. It signals a programming error and is never classified as transient.
 */
public class NoTransactionException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoTransactionException() {
    super("A transaction has not been created for this connection");
  }
}
