package com.example.reliableconnection.core.provider;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.Set;

/**
 * Driver-independent rules for {@link SQLException}s and socket failures.
 *
 * <p>An {@link SQLException} is transient when any of the following match:
 *
 * <ul>
 *   <li>it is an {@link SQLTransientException} or {@link SQLRecoverableException}
 *   <li>SQLState class {@code 08} (connection exception) or {@code 40001} (serialization failure)
 *   <li>the vendor error code is accepted by {@link #isTransientErrorCode(int)}
 *   <li>the message mentions a dropped or refused connection, a timeout or the pool, unless the
 *       SQLState class already names a permanent error such as a syntax error or a constraint
 *       violation
 * </ul>
 *
 * <p>Subclasses add vendor error codes and SQLStates.
 */
public class StandardJdbcProvider implements DbProvider {

  private static final String[] TRANSIENT_KEYWORDS = {
    "connection refused",
    "connection reset",
    "i/o error",
    "socket closed",
    "broken pipe",
    "timeout",
    "pool"
  };

  // data, integrity, transaction state, authorization, catalog and syntax errors
  private static final Set<String> PERMANENT_STATE_CLASSES =
      Set.of("0A", "21", "22", "23", "25", "28", "2B", "2D", "3D", "3F", "42", "44");

  @Override
  public String name() {
    return "jdbc";
  }

  @Override
  public Set<String> supportedTags() {
    return Set.of(
        SQLException.class.getName(),
        SocketException.class.getName(),
        SocketTimeoutException.class.getName());
  }

  @Override
  public boolean isTransient(final Throwable error) {
    if (error instanceof SocketException || error instanceof SocketTimeoutException) return true;
    if (!(error instanceof SQLException)) return false;

    final var sql = (SQLException) error;
    if (sql instanceof SQLTransientException || sql instanceof SQLRecoverableException) return true;

    final var state = sql.getSQLState();
    if (state != null && isTransientSqlState(state)) return true;

    if (isTransientErrorCode(sql.getErrorCode())) return true;

    if (isPermanentSqlState(state)) return false;
    return mentionsTransientCondition(sql.getMessage());
  }

  /**
   * Returns whether an SQLState marks a transient condition.
   *
   * @param sqlState the five character state, never {@code null}
   * @return true for connection exceptions and serialization failures
   */
  protected boolean isTransientSqlState(final String sqlState) {
    return sqlState.startsWith("08") || "40001".equals(sqlState);
  }

  /**
   * Returns whether a vendor error code marks a transient condition. Error codes are vendor
   * specific, so the generic rules accept none.
   *
   * @param errorCode the value of {@link SQLException#getErrorCode()}
   * @return false unless overridden
   */
  protected boolean isTransientErrorCode(final int errorCode) {
    return false;
  }

  static boolean isPermanentSqlState(final String sqlState) {
    return sqlState != null
        && sqlState.length() >= 2
        && PERMANENT_STATE_CLASSES.contains(sqlState.substring(0, 2).toUpperCase(Locale.ROOT));
  }

  static boolean mentionsTransientCondition(final String message) {
    if (message == null) return false;
    final var lower = message.toLowerCase(Locale.ROOT);
    for (final var keyword : TRANSIENT_KEYWORDS) if (lower.contains(keyword)) return true;
    return false;
  }
}
