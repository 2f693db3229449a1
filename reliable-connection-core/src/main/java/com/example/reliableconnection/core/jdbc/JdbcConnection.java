package com.example.reliableconnection.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.reliableconnection.core.provider.ProviderTagged;
import com.example.reliableconnection.core.spi.ConnectionState;
import com.example.reliableconnection.core.spi.DbConnection;
import com.example.reliableconnection.core.spi.DbTransaction;
import com.example.reliableconnection.core.spi.IsolationLevel;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import javax.sql.DataSource;

/**
 * {@link DbConnection} over JDBC. Each {@link #open()} acquires a physical {@link Connection} from
 * a {@link ConnectionSource}; {@link #disconnect()} closes it, which returns it to the pool when
 * the source is a pooled {@link DataSource}.
 *
 * <p>Asynchronous operations run the blocking JDBC call on the configured {@link Executor}. The
 * default is the common fork-join pool; pass a dedicated executor for production workloads.
 *
 * <pre>{@code
 * var hikari = new HikariDataSource(config);
 * var connection = JdbcConnection.fromDataSource(hikari, Executors.newFixedThreadPool(8));
 * }</pre>
 */
public final class JdbcConnection implements DbConnection, ProviderTagged {

  private static final System.Logger LOGGER = System.getLogger(JdbcConnection.class.getName());

  private final Properties properties;
  private final Executor executor;
  private ConnectionSource source;
  private String connectionString;
  private Connection physical;
  private boolean closed;

  private JdbcConnection(
      final ConnectionSource source,
      final String connectionString,
      final Properties properties,
      final Executor executor) {
    this.source = source;
    this.connectionString = connectionString;
    this.properties = properties;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public static JdbcConnection fromDataSource(final DataSource dataSource) {
    return fromDataSource(dataSource, ForkJoinPool.commonPool());
  }

  public static JdbcConnection fromDataSource(
      final DataSource dataSource, final Executor executor) {
    return new JdbcConnection(ConnectionSource.of(dataSource), null, new Properties(), executor);
  }

  public static JdbcConnection fromUrl(final String url, final Properties properties) {
    return fromUrl(url, properties, ForkJoinPool.commonPool());
  }

  /**
   * Creates a connection that opens through {@link java.sql.DriverManager}. The URL doubles as the
   * connection string and can be changed while the connection is closed.
   *
   * @param url JDBC URL
   * @param properties driver properties, copied
   * @param executor runs asynchronous operations
   * @return the closed connection
   */
  public static JdbcConnection fromUrl(
      final String url, final Properties properties, final Executor executor) {
    Objects.requireNonNull(url, "url");
    final var copy = new Properties();
    if (properties != null) copy.putAll(properties);
    return new JdbcConnection(ConnectionSource.of(url, copy), url, copy, executor);
  }

  public static JdbcConnection of(final ConnectionSource source, final Executor executor) {
    return new JdbcConnection(
        Objects.requireNonNull(source, "source"), null, new Properties(), executor);
  }

  @Override
  public void open() throws SQLException {
    if (closed) throw new IllegalStateException("Connection has been closed");
    if (physical != null && !physical.isClosed())
      throw new IllegalStateException("Connection is already open");

    physical = Objects.requireNonNull(source.getConnection(), "source returned null connection");
    LOGGER.log(DEBUG, "Physical connection acquired");
  }

  @Override
  public CompletableFuture<Void> openAsync() {
    return supplyAsync(
        () -> {
          open();
          return null;
        });
  }

  @Override
  public void disconnect() throws SQLException {
    final var current = physical;
    physical = null;
    if (current != null) {
      current.close();
      LOGGER.log(DEBUG, "Physical connection released");
    }
  }

  @Override
  public void close() throws SQLException {
    closed = true;
    disconnect();
  }

  @Override
  public JdbcCommand createCommand() {
    return new JdbcCommand(this);
  }

  @Override
  public DbTransaction beginTransaction(final IsolationLevel isolationLevel) throws SQLException {
    Objects.requireNonNull(isolationLevel, "isolationLevel");
    return JdbcTransaction.begin(this, requireOpen(), isolationLevel);
  }

  /**
   * Reports {@link ConnectionState#BROKEN} when the physical connection was closed underneath this
   * object, for example by the pool or the server.
   */
  @Override
  public ConnectionState getState() {
    if (physical == null) return ConnectionState.CLOSED;
    try {
      return physical.isClosed() ? ConnectionState.BROKEN : ConnectionState.OPEN;
    } catch (final SQLException e) {
      return ConnectionState.BROKEN;
    }
  }

  @Override
  public String getConnectionString() {
    return connectionString;
  }

  /**
   * Replaces the JDBC URL used by the next {@link #open()}. The driver properties given at
   * construction still apply.
   *
   * @throws IllegalStateException if the connection is open
   */
  @Override
  public void setConnectionString(final String connectionString) {
    Objects.requireNonNull(connectionString, "connectionString");
    if (physical != null)
      throw new IllegalStateException(
          "Connection string cannot change while the connection is open");
    this.connectionString = connectionString;
    this.source = ConnectionSource.of(connectionString, properties);
  }

  @Override
  public String getDatabase() throws SQLException {
    return physical == null ? null : physical.getCatalog();
  }

  @Override
  public void changeDatabase(final String database) throws SQLException {
    requireOpen().setCatalog(database);
  }

  @Override
  public <T> T unwrap(final Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    if (physical != null) {
      if (iface.isInstance(physical)) return iface.cast(physical);
      if (physical.isWrapperFor(iface)) return physical.unwrap(iface);
    }
    throw new SQLException("Not a wrapper for " + iface.getName());
  }

  /**
   * Derives the provider tag from the JDBC sub-protocol, so {@code jdbc:postgresql://...} maps to
   * {@code "postgresql"}. MariaDB URLs map to {@code "mysql"}.
   */
  @Override
  public String providerTag() {
    if (connectionString == null || !connectionString.startsWith("jdbc:")) return null;
    final var rest = connectionString.substring("jdbc:".length());
    final var end = rest.indexOf(':');
    if (end <= 0) return null;
    final var subProtocol = rest.substring(0, end).toLowerCase(Locale.ROOT);
    return "mariadb".equals(subProtocol) ? "mysql" : subProtocol;
  }

  Connection requireOpen() throws SQLException {
    if (physical == null) throw new SQLException("Connection is not open", "08003");
    return physical;
  }

  <T> CompletableFuture<T> supplyAsync(final SqlCall<T> call) {
    try {
      return CompletableFuture.supplyAsync(
          () -> {
            try {
              return call.call();
            } catch (final SQLException e) {
              throw new CompletionException(e);
            }
          },
          executor);
    } catch (final RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Blocking JDBC call run on the connection's executor. */
  @FunctionalInterface
  interface SqlCall<T> {
    T call() throws SQLException;
  }
}
