package com.example.reliableconnection.core.provider;

import java.util.Set;

/** Transient error numbers reported by Microsoft SQL Server and Azure SQL Database. */
public final class SqlServerProvider extends StandardJdbcProvider {

  static final String EXCEPTION_TYPE = "com.microsoft.sqlserver.jdbc.SQLServerException";

  private static final Set<Integer> TRANSIENT_ERROR_NUMBERS =
      Set.of(
          20, // instance does not support encryption
          64, // connection dropped during login
          233, // no process on the other end of the pipe
          10053, // connection aborted by the host
          10054, // connection reset by the remote host
          10060, // network timeout
          10928, // resource limit reached
          10929, // minimum resource guarantee not met
          11001, // host not found
          40143, // connection could not be initialized
          40197, // service error while processing the request
          40501, // service busy
          40540, // service has encountered an error
          40613); // database unavailable

  @Override
  public String name() {
    return "sqlserver";
  }

  @Override
  public Set<String> supportedTags() {
    return Set.of(EXCEPTION_TYPE, "sqlserver");
  }

  @Override
  protected boolean isTransientErrorCode(final int errorCode) {
    return TRANSIENT_ERROR_NUMBERS.contains(errorCode);
  }
}
