package com.example.reliableconnection.core.spi;

import java.sql.Connection;

/**
 * Transaction isolation levels, mapped onto the {@code java.sql.Connection.TRANSACTION_*}
 * constants.
 */
public enum IsolationLevel {
  /** Keep whatever level the driver or connection is currently using. */
  UNSPECIFIED(-1),
  READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),
  READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
  REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
  SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

  private final int jdbcLevel;

  IsolationLevel(final int jdbcLevel) {
    this.jdbcLevel = jdbcLevel;
  }

  /**
   * Returns the JDBC constant for this level.
   *
   * @return the {@code Connection.TRANSACTION_*} value, or -1 for {@link #UNSPECIFIED}
   */
  public int jdbcLevel() {
    return jdbcLevel;
  }

  /**
   * Maps a JDBC isolation constant back to a level.
   *
   * @param jdbcLevel a {@code Connection.TRANSACTION_*} value
   * @return the matching level, or {@link #UNSPECIFIED} if none matches
   */
  public static IsolationLevel fromJdbc(final int jdbcLevel) {
    for (final var level : values()) if (level.jdbcLevel == jdbcLevel) return level;
    return UNSPECIFIED;
  }
}
