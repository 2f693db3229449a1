package com.example.reliableconnection.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.reliableconnection.core.provider.ProviderRegistry;
import com.example.reliableconnection.core.retry.FaultClassifier;
import com.example.reliableconnection.core.retry.RetryExecutor;
import com.example.reliableconnection.core.retry.RetryPolicy;
import com.example.reliableconnection.core.retry.RetryStrategy;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.DbConnection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link WrappedConnection} that opens under a {@link RetryStrategy} and hands out {@link
 * ReliableCommand}s using the same strategy.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var connection = ReliableConnection.builder()
 *     .connection(JdbcConnection.fromUrl(url, properties))
 *     .retryPolicy(RetryPolicy.builder().maxRetryCount(5).build())
 *     .build();
 * connection.open();
 * }</pre>
 *
 * <p>When a retried command finds the connection closed, it reopens it on the inner connection
 * directly; the surrounding retry already covers that open.
 */
public class ReliableConnection extends WrappedConnection {

  private static final System.Logger LOGGER = System.getLogger(ReliableConnection.class.getName());

  private final RetryStrategy retryStrategy;

  /**
   * Wraps a connection with the default policy, classifying failures with the default provider
   * registry.
   *
   * @param inner the connection to wrap
   */
  public ReliableConnection(final DbConnection inner) {
    this(inner, defaultStrategy(inner, RetryPolicy.defaults(), null));
  }

  public ReliableConnection(final DbConnection inner, final RetryStrategy retryStrategy) {
    super(inner);
    this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Wraps and opens a connection.
   *
   * @param inner the connection to wrap
   * @param retryStrategy retries the open and every command
   * @return the open connection
   * @throws SQLException if the connection could not be opened; the wrapper is closed first
   */
  public static ReliableConnection open(final DbConnection inner, final RetryStrategy retryStrategy)
      throws SQLException {
    final var connection = new ReliableConnection(inner, retryStrategy);
    try {
      connection.open();
      return connection;
    } catch (final SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (final SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  public RetryStrategy getRetryStrategy() {
    return retryStrategy;
  }

  @Override
  public void open() throws SQLException {
    retryStrategy.executeWithRetry(
        null,
        () -> {
          getInnerConnection().open();
          return null;
        });
    LOGGER.log(DEBUG, "Connection opened");
  }

  @Override
  public CompletableFuture<Void> openAsync() {
    return retryStrategy.executeWithRetryAsync(null, () -> getInnerConnection().openAsync());
  }

  @Override
  public ReliableCommand createCommand() throws SQLException {
    return (ReliableCommand) super.createCommand();
  }

  @Override
  protected ReliableCommand newCommand(final DbCommand innerCommand) {
    return new ReliableCommand(this, innerCommand, retryStrategy);
  }

  private static RetryStrategy defaultStrategy(
      final DbConnection inner, final RetryPolicy policy, final FaultClassifier classifier) {
    return new RetryExecutor(
        policy,
        classifier != null ? classifier : ProviderRegistry.defaultRegistry().classifierFor(inner));
  }

  /** Fluent builder for {@link ReliableConnection}. */
  public static final class Builder {
    private DbConnection connection;
    private RetryStrategy retryStrategy;
    private RetryPolicy retryPolicy;
    private FaultClassifier classifier;

    private Builder() {}

    public Builder connection(final DbConnection connection) {
      this.connection = connection;
      return this;
    }

    /**
     * Sets the strategy that runs opens and commands. Cannot be combined with {@link
     * #retryPolicy(RetryPolicy)} or {@link #classifier(FaultClassifier)}.
     *
     * @param retryStrategy the strategy
     * @return this builder
     */
    public Builder retryStrategy(final RetryStrategy retryStrategy) {
      this.retryStrategy = retryStrategy;
      return this;
    }

    /**
     * Sets the policy for a {@link RetryExecutor} built for this connection.
     *
     * <p>Default: {@link RetryPolicy#defaults()}
     *
     * @param retryPolicy the policy
     * @return this builder
     */
    public Builder retryPolicy(final RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the classifier for a {@link RetryExecutor} built for this connection.
     *
     * <p>Default: the default provider registry, consulting the connection's own provider first
     *
     * @param classifier decides which failures are transient
     * @return this builder
     */
    public Builder classifier(final FaultClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public ReliableConnection build() {
      if (connection == null) throw new IllegalStateException("connection is required");
      if (retryStrategy != null && (retryPolicy != null || classifier != null))
        throw new IllegalStateException(
            "retryStrategy cannot be combined with retryPolicy or classifier");

      final var strategy =
          retryStrategy != null
              ? retryStrategy
              : defaultStrategy(
                  connection,
                  retryPolicy != null ? retryPolicy : RetryPolicy.defaults(),
                  classifier);
      return new ReliableConnection(connection, strategy);
    }
  }
}
