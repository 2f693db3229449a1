package com.example.reliableconnection.core.provider;

import java.util.Set;

/**
 * Vendor-specific behavior looked up through a {@link ProviderRegistry}.
 *
 * <p>Tags are either fully qualified type names (for example {@code
 * "org.postgresql.util.PSQLException"}) or short capability tags returned by {@link
 * ProviderTagged#providerTag()}.
 */
public interface DbProvider {

  String name();

  /**
   * Returns the tags this provider should be registered under.
   *
   * @return the tags, never {@code null}
   */
  Set<String> supportedTags();

  /**
   * Decides whether the given failure is transient for this vendor.
   *
   * @param error a single throwable, causes are walked by the registry
   * @return true if retrying may succeed; false by default
   */
  default boolean isTransient(final Throwable error) {
    return false;
  }
}
