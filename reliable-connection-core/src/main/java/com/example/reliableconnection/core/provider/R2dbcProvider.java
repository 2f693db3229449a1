package com.example.reliableconnection.core.provider;

import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcTransientException;
import java.util.Set;

/** Rules for {@link R2dbcException}s raised by reactive drivers. */
public final class R2dbcProvider implements DbProvider {

  @Override
  public String name() {
    return "r2dbc";
  }

  @Override
  public Set<String> supportedTags() {
    return Set.of(R2dbcException.class.getName());
  }

  @Override
  public boolean isTransient(final Throwable error) {
    if (!(error instanceof R2dbcException)) return false;
    if (error instanceof R2dbcTransientException) return true;

    final var sqlState = ((R2dbcException) error).getSqlState();
    if (sqlState != null && sqlState.startsWith("08")) return true;

    if (StandardJdbcProvider.isPermanentSqlState(sqlState)) return false;
    return StandardJdbcProvider.mentionsTransientCondition(error.getMessage());
  }
}
