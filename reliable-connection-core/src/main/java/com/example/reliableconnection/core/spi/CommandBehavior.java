package com.example.reliableconnection.core.spi;

/** Hints passed to {@link DbCommand#executeReader(CommandBehavior)}. */
public enum CommandBehavior {
  DEFAULT,
  SINGLE_RESULT,
  SINGLE_ROW
}
