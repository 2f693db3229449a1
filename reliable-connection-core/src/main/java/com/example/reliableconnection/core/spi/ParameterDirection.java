package com.example.reliableconnection.core.spi;

public enum ParameterDirection {
  INPUT,
  OUTPUT,
  INPUT_OUTPUT,
  RETURN_VALUE;

  /** Returns true if the value is sent to the database. */
  public boolean isInput() {
    return this == INPUT || this == INPUT_OUTPUT;
  }

  /** Returns true if the value is read back after execution. */
  public boolean isOutput() {
    return this != INPUT;
  }
}
