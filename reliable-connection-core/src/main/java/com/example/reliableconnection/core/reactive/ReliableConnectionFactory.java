package com.example.reliableconnection.core.reactive;

import com.example.reliableconnection.core.provider.ProviderRegistry;
import com.example.reliableconnection.core.retry.FaultClassifier;
import com.example.reliableconnection.core.retry.RetryPolicy;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * R2DBC {@link ConnectionFactory} that retries connection acquisition on transient failures.
 *
 * <pre>{@code
 * var factory = ReliableConnectionFactory.builder()
 *     .connectionFactory(ConnectionFactories.get("r2dbc:postgresql://db/app"))
 *     .retryPolicy(RetryPolicy.builder().maxRetryCount(5).build())
 *     .build();
 *
 * Mono.usingWhen(
 *     factory.create(),
 *     conn -> Mono.from(conn.createStatement("SELECT 1").execute()),
 *     conn -> Mono.from(conn.close()));
 * }</pre>
 */
public final class ReliableConnectionFactory implements ConnectionFactory {

  private final ConnectionFactory delegate;
  private final RetryPolicy policy;
  private final Retry retry;

  private ReliableConnectionFactory(final Builder builder) {
    this.delegate = builder.connectionFactory;
    this.policy = builder.retryPolicy;
    this.retry = ReactiveRetry.from(builder.retryPolicy, builder.classifier);
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy getRetryPolicy() {
    return policy;
  }

  /**
   * Acquires a connection from the delegate, resubscribing on transient failures.
   *
   * @return a Mono emitting the acquired Connection
   */
  @Override
  public Mono<Connection> create() {
    return Mono.defer(() -> Mono.from(delegate.create()))
        .cast(Connection.class)
        .retryWhen(retry);
  }

  @Override
  public ConnectionFactoryMetadata getMetadata() {
    return delegate.getMetadata();
  }

  /** Builder for {@link ReliableConnectionFactory}. */
  public static final class Builder {
    private ConnectionFactory connectionFactory;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private FaultClassifier classifier;

    private Builder() {}

    /**
     * Sets the factory connections are acquired from (required).
     *
     * @param connectionFactory the delegate
     * @return this builder
     */
    public Builder connectionFactory(final ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Sets the retry policy.
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
     * Sets the fault classifier.
     *
     * <p>Default: {@link ProviderRegistry#defaultRegistry()}
     *
     * @param classifier decides which failures are transient
     * @return this builder
     */
    public Builder classifier(final FaultClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Builds the factory.
     *
     * @return configured factory
     * @throws IllegalStateException if required fields are not set
     */
    public ReliableConnectionFactory build() {
      if (connectionFactory == null)
        throw new IllegalStateException("connectionFactory is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (classifier == null) classifier = ProviderRegistry.defaultRegistry();
      return new ReliableConnectionFactory(this);
    }
  }
}
