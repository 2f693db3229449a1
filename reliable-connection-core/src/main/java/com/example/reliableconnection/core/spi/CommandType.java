package com.example.reliableconnection.core.spi;

/** How the text of a {@link DbCommand} is interpreted. */
public enum CommandType {
  TEXT,
  STORED_PROCEDURE
}
