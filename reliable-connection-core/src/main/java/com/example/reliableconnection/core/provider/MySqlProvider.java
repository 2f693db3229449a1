package com.example.reliableconnection.core.provider;

import java.util.Set;

/**
 * Transient conditions reported by MySQL Connector/J.
 *
 * <p>Communication failures surface as {@code CommunicationsException} or, outside the JDBC layer,
 * {@code CJCommunicationsException}; both are always transient. Otherwise the server and client
 * error numbers below decide.
 */
public final class MySqlProvider extends StandardJdbcProvider {

  private static final String CJ_COMMUNICATIONS_EXCEPTION =
      "com.mysql.cj.exceptions.CJCommunicationsException";

  private static final Set<Integer> TRANSIENT_ERROR_NUMBERS =
      Set.of(
          1042, // ER_BAD_HOST_ERROR
          1205, // ER_LOCK_WAIT_TIMEOUT
          1213, // ER_LOCK_DEADLOCK
          2002, // CR_CONNECTION_ERROR
          2003, // CR_CONN_HOST_ERROR
          2006, // CR_SERVER_GONE_ERROR
          2009, // CR_WRONG_HOST_INFO
          2013); // CR_SERVER_LOST

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public Set<String> supportedTags() {
    return Set.of(
        "com.mysql.cj.jdbc.exceptions.CommunicationsException",
        "com.mysql.cj.jdbc.exceptions.MySQLTransactionRollbackException",
        "com.mysql.cj.jdbc.exceptions.MySQLTimeoutException",
        CJ_COMMUNICATIONS_EXCEPTION,
        "mysql");
  }

  @Override
  public boolean isTransient(final Throwable error) {
    if (error != null && isCommunicationsFailure(error.getClass())) return true;
    return super.isTransient(error);
  }

  @Override
  protected boolean isTransientErrorCode(final int errorCode) {
    return TRANSIENT_ERROR_NUMBERS.contains(errorCode);
  }

  private static boolean isCommunicationsFailure(final Class<?> type) {
    for (var current = type; current != null; current = current.getSuperclass()) {
      final var name = current.getName();
      if (name.equals(CJ_COMMUNICATIONS_EXCEPTION)
          || name.equals("com.mysql.cj.jdbc.exceptions.CommunicationsException")) return true;
    }
    return false;
  }
}
