package com.example.reliableconnection.core.provider;

import java.util.Set;

/** Transient SQLStates reported by PostgreSQL in addition to the standard ones. */
public final class PostgresProvider extends StandardJdbcProvider {

  private static final Set<String> TRANSIENT_STATES =
      Set.of(
          "40P01", // deadlock_detected
          "53300", // too_many_connections
          "57P01", // admin_shutdown
          "57P02", // crash_shutdown
          "57P03"); // cannot_connect_now

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public Set<String> supportedTags() {
    return Set.of("org.postgresql.util.PSQLException", "postgresql");
  }

  @Override
  protected boolean isTransientSqlState(final String sqlState) {
    return super.isTransientSqlState(sqlState) || TRANSIENT_STATES.contains(sqlState);
  }
}
