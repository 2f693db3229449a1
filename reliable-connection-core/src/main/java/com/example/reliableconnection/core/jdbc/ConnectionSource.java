package com.example.reliableconnection.core.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import javax.sql.DataSource;

/** Supplies physical JDBC connections to a {@link JdbcConnection}. */
@FunctionalInterface
public interface ConnectionSource {

  /**
   * Acquires a new physical connection.
   *
   * @return an open connection the caller must close
   * @throws SQLException if the connection cannot be established
   */
  Connection getConnection() throws SQLException;

  static ConnectionSource of(final DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }

  /**
   * Connects through {@link DriverManager}.
   *
   * @param url JDBC URL
   * @param properties driver properties such as {@code user} and {@code password}
   * @return the source
   */
  static ConnectionSource of(final String url, final Properties properties) {
    Objects.requireNonNull(url, "url");
    final var copy = new Properties();
    if (properties != null) copy.putAll(properties);
    return () -> DriverManager.getConnection(url, copy);
  }
}
