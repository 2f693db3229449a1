package com.example.reliableconnection.core.spi;

/** Observable state of a {@link DbConnection}. */
public enum ConnectionState {
  CLOSED,
  OPEN,
  /** The physical link was lost; the connection must be closed before it can be reopened. */
  BROKEN
}
