package com.example.reliableconnection.core.spi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Binary parameter value backed by an {@link InputStream} that is reopened on every reset.
 *
 * <pre>{@code
 * command.getParameters().add(
 *     new DbParameter("payload", new StreamParameterValue(() -> Files.newInputStream(path))));
 * }</pre>
 */
public final class StreamParameterValue implements ResettableParameterValue {

  private final Supplier<? extends InputStream> opener;
  private InputStream current;

  /**
   * Creates a value that opens a fresh stream whenever one is needed.
   *
   * @param opener opens the stream from the beginning
   */
  public StreamParameterValue(final Supplier<? extends InputStream> opener) {
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  /**
   * Returns the current stream, opening it on first use.
   *
   * @return the stream to bind
   */
  public synchronized InputStream stream() {
    if (current == null) current = Objects.requireNonNull(opener.get(), "opener returned null");
    return current;
  }

  @Override
  public synchronized void reset() {
    if (current == null) return;
    try {
      current.close();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to close parameter stream", e);
    } finally {
      current = null;
    }
  }
}
