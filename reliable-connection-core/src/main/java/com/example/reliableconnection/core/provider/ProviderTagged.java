package com.example.reliableconnection.core.provider;

/**
 * Implemented by objects that name their {@link DbProvider} explicitly instead of relying on the
 * type-name lookup.
 */
@FunctionalInterface
public interface ProviderTagged {

  /**
   * Returns the tag under which this object's provider is registered.
   *
   * @return a stable tag such as {@code "postgresql"}
   */
  String providerTag();
}
