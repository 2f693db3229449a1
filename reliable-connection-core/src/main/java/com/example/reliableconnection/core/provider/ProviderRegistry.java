package com.example.reliableconnection.core.provider;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.reliableconnection.core.retry.FaultClassifier;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Maps tags to {@link DbProvider}s and classifies failures through them.
 *
 * <p>Lookup for an object tries, in order: the tag of a {@link ProviderTagged} object, the name of
 * its runtime class, the names of its superclasses, then the names of every implemented interface.
 * When nothing matches, a default provider that treats no failure as transient is returned.
 *
 * <p>Registration and lookup are safe from any thread. Registering a tag again replaces the
 * previous provider; later lookups see the most recent registration.
 *
 * <pre>{@code
 * var registry = ProviderRegistry.withBuiltIns();
 * registry.register(new MyVendorProvider());
 *
 * if (registry.isTransient(e)) { ... }
 * }</pre>
 */
public final class ProviderRegistry implements FaultClassifier {

  private static final System.Logger LOGGER = System.getLogger(ProviderRegistry.class.getName());

  /** Provider returned when no registration matches. Never reports a failure as transient. */
  public static final DbProvider DEFAULT_PROVIDER =
      new DbProvider() {
        @Override
        public String name() {
          return "default";
        }

        @Override
        public Set<String> supportedTags() {
          return Set.of();
        }
      };

  private final Map<String, DbProvider> providers = new ConcurrentHashMap<>();

  /** Creates an empty registry. */
  public ProviderRegistry() {}

  /**
   * Creates a registry holding the built-in providers for standard JDBC, SQL Server, MySQL,
   * PostgreSQL and R2DBC.
   *
   * @return new registry
   */
  public static ProviderRegistry withBuiltIns() {
    final var registry = new ProviderRegistry();
    registry.register(new StandardJdbcProvider());
    registry.register(new SqlServerProvider());
    registry.register(new MySqlProvider());
    registry.register(new PostgresProvider());
    registry.register(new R2dbcProvider());
    return registry;
  }

  /**
   * Returns the shared registry: the built-in providers plus every {@link DbProvider} found with
   * {@link ServiceLoader}. Built lazily on first use.
   *
   * @return the shared registry
   */
  public static ProviderRegistry defaultRegistry() {
    return DefaultHolder.INSTANCE;
  }

  /**
   * Registers a provider under each of its tags, replacing earlier registrations.
   *
   * @param provider the provider
   * @return this registry
   */
  public ProviderRegistry register(final DbProvider provider) {
    Objects.requireNonNull(provider, "provider");
    final var tags = Objects.requireNonNull(provider.supportedTags(), "supportedTags");
    for (final var tag : tags) {
      final var previous = providers.put(tag, provider);
      if (previous != null && previous != provider)
        LOGGER.log(
            DEBUG,
            "Provider {0} replaces {1} for tag {2}",
            provider.name(),
            previous.name(),
            tag);
    }
    return this;
  }

  /**
   * Looks up the provider registered under a tag.
   *
   * @param tag a type name or capability tag
   * @return the provider, or {@link #DEFAULT_PROVIDER}
   */
  public DbProvider forTag(final String tag) {
    if (tag == null) return DEFAULT_PROVIDER;
    return providers.getOrDefault(tag, DEFAULT_PROVIDER);
  }

  /**
   * Looks up the provider for an object: its explicit tag first, then its type ancestry.
   *
   * @param target a connection, command, exception or any other object
   * @return the provider, or {@link #DEFAULT_PROVIDER}
   */
  public DbProvider forObject(final Object target) {
    if (target == null) return DEFAULT_PROVIDER;

    if (target instanceof ProviderTagged) {
      final var tag = ((ProviderTagged) target).providerTag();
      final var tagged = tag == null ? null : providers.get(tag);
      if (tagged != null) return tagged;
    }

    return forType(target.getClass());
  }

  /**
   * Looks up the provider for a type, walking superclasses and then interfaces.
   *
   * @param type the type to resolve
   * @return the provider, or {@link #DEFAULT_PROVIDER}
   */
  public DbProvider forType(final Class<?> type) {
    if (type == null || providers.isEmpty()) return DEFAULT_PROVIDER;

    final var interfaces = new ArrayDeque<Class<?>>();
    for (var current = type; current != null; current = current.getSuperclass()) {
      final var provider = providers.get(current.getName());
      if (provider != null) return provider;
      Collections.addAll(interfaces, current.getInterfaces());
    }

    final var seen = new LinkedHashSet<Class<?>>();
    while (!interfaces.isEmpty()) {
      final var iface = interfaces.poll();
      if (!seen.add(iface)) continue;
      final var provider = providers.get(iface.getName());
      if (provider != null) return provider;
      Collections.addAll(interfaces, iface.getInterfaces());
    }

    return DEFAULT_PROVIDER;
  }

  /**
   * Returns every distinct registered provider.
   *
   * @return snapshot of the providers
   */
  public Set<DbProvider> providers() {
    final Set<DbProvider> result = Collections.newSetFromMap(new IdentityHashMap<>());
    result.addAll(providers.values());
    return result;
  }

  /**
   * Classifies a failure. Futures' wrapper exceptions are unwrapped; then every throwable in the
   * cause chain, and every {@link SQLException} chained with {@link SQLException#getNextException},
   * is offered to the provider found for its type. The failure is transient if any provider says
   * so.
   *
   * @param error the failure to classify
   * @return true if retrying may succeed
   */
  @Override
  public boolean isTransient(final Throwable error) {
    final Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    final var pending = new ArrayDeque<Throwable>();
    if (error != null) pending.add(unwrap(error));

    while (!pending.isEmpty()) {
      final var current = pending.poll();
      if (!visited.add(current)) continue;

      if (forObject(current).isTransient(current)) return true;

      if (current.getCause() != null) pending.add(current.getCause());
      if (current instanceof SQLException) {
        final var next = ((SQLException) current).getNextException();
        if (next != null) pending.add(next);
      }
    }
    return false;
  }

  /**
   * Returns a classifier that first consults the provider of {@code origin}, such as a connection
   * carrying a {@link ProviderTagged} tag, and then the providers of the failure's own types. The
   * origin's provider is looked up on every call, so a tag that changes later is honored.
   *
   * @param origin the object the failure came from
   * @return classifier bound to {@code origin}
   */
  public FaultClassifier classifierFor(final Object origin) {
    if (origin == null) return this;
    return error -> forObject(origin).isTransient(unwrap(error)) || isTransient(error);
  }

  private static Throwable unwrap(final Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) current = current.getCause();
    return current;
  }

  private static final class DefaultHolder {
    private static final ProviderRegistry INSTANCE = load();

    private static ProviderRegistry load() {
      final var registry = withBuiltIns();
      try {
        ServiceLoader.load(DbProvider.class, ProviderRegistry.class.getClassLoader()).stream()
            .forEach(
                found -> {
                  try {
                    final var provider = found.get();
                    registry.register(provider);
                    LOGGER.log(DEBUG, "Registered provider {0}", provider.name());
                  } catch (final ServiceConfigurationError e) {
                    LOGGER.log(WARNING, "Skipping provider {0}: {1}", found.type(), e.getMessage());
                  }
                });
      } catch (final ServiceConfigurationError e) {
        LOGGER.log(WARNING, "Provider discovery failed: {0}", e.getMessage());
      }
      return registry;
    }
  }
}
