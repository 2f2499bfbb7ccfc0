package io.github.wphillipmoore.system.override;

import io.github.wphillipmoore.system.override.exception.StateAccessDeniedException;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reflection-based {@link SystemStateAccessor} for the process environment.
 *
 * <p>{@link System#getenv()} is an unmodifiable view, so writes go to the map behind that view.
 * On Windows the JDK also keeps {@code ProcessEnvironment.theCaseInsensitiveEnvironment}, the
 * store {@link System#getenv(String)} reads from; when present it is updated together with the
 * primary store.
 *
 * <p>On JDK 17 this needs {@code --add-opens java.base/java.util=ALL-UNNAMED} and {@code
 * --add-opens java.base/java.lang=ALL-UNNAMED}. Without them every {@link #replace} fails with
 * {@link StateAccessDeniedException}. Child processes started afterwards are not affected; only
 * reads through {@link System#getenv} observe the override.
 */
public final class EnvironmentAccessor implements SystemStateAccessor {

  static final String NAME = "environment";
  static final String PROCESS_ENVIRONMENT_CLASS = "java.lang.ProcessEnvironment";
  static final String CASE_INSENSITIVE_FIELD = "theCaseInsensitiveEnvironment";
  static final String UNMODIFIABLE_MAP_FIELD = "m";

  private static final Logger LOG = LoggerFactory.getLogger(EnvironmentAccessor.class);

  /** Locates every mutable store behind the environment read API. */
  @FunctionalInterface
  interface BackingStores {
    List<Map<String, String>> locate();
  }

  private final Supplier<Map<String, String>> reader;
  private final BackingStores backingStores;

  /** Creates an accessor for the live process environment. */
  public EnvironmentAccessor() {
    this(System::getenv, EnvironmentAccessor::locateBackingStores);
  }

  /**
   * Creates an accessor with injected read and write paths. Package-private for testing.
   *
   * @param reader supplies the current environment view
   * @param backingStores locates the stores to write
   */
  EnvironmentAccessor(Supplier<Map<String, String>> reader, BackingStores backingStores) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.backingStores = Objects.requireNonNull(backingStores, "backingStores");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Map<String, String> snapshot() {
    try {
      return Map.copyOf(reader.get());
    } catch (SecurityException e) {
      throw denied("Reading the environment was denied", e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Entries are validated and every backing store is located before any store is cleared, so
   * a rejected call leaves the environment untouched.
   *
   * @throws IllegalArgumentException if a key contains {@code '='} or a key or value contains
   *     {@code '\0'}
   * @throws StateAccessDeniedException if the backing stores cannot be reached
   */
  @Override
  public void replace(Map<String, ? extends @Nullable String> table) {
    Objects.requireNonNull(table, "table");
    validate(table);
    List<Map<String, String>> stores = backingStores.locate();
    for (Map<String, String> store : stores) {
      store.clear();
    }
    for (Map<String, String> store : stores) {
      table.forEach(
          (key, value) -> {
            if (value != null) {
              store.put(key, value);
            }
          });
    }
  }

  static List<Map<String, String>> locateBackingStores() {
    List<Map<String, String>> stores = new ArrayList<>(2);
    stores.add(unmodifiableDelegate(System.getenv()));
    Map<String, String> caseInsensitive = caseInsensitiveEnvironment();
    if (caseInsensitive != null) {
      stores.add(caseInsensitive);
    }
    LOG.debug("Located {} environment backing store(s)", stores.size());
    return stores;
  }

  /**
   * Returns the map wrapped by an unmodifiable view.
   *
   * @param view a map created by {@link java.util.Collections#unmodifiableMap}
   * @return the wrapped, writable map
   * @throws StateAccessDeniedException if the wrapped map cannot be reached
   */
  @SuppressWarnings("unchecked")
  static Map<String, String> unmodifiableDelegate(Map<String, String> view) {
    try {
      Field field = view.getClass().getDeclaredField(UNMODIFIABLE_MAP_FIELD);
      field.setAccessible(true);
      return (Map<String, String>) field.get(view);
    } catch (NoSuchFieldException | IllegalAccessException | RuntimeException e) {
      throw denied("Cannot reach the map backing System.getenv()", e);
    }
  }

  @SuppressWarnings("unchecked")
  static @Nullable Map<String, String> caseInsensitiveEnvironment() {
    Field field;
    try {
      field = Class.forName(PROCESS_ENVIRONMENT_CLASS).getDeclaredField(CASE_INSENSITIVE_FIELD);
    } catch (NoSuchFieldException e) {
      // Windows only
      return null;
    } catch (ClassNotFoundException | RuntimeException e) {
      throw denied("Cannot reach " + PROCESS_ENVIRONMENT_CLASS, e);
    }
    try {
      field.setAccessible(true);
      return (Map<String, String>) field.get(null);
    } catch (IllegalAccessException | RuntimeException e) {
      throw denied("Cannot reach the case-insensitive environment", e);
    }
  }

  private static void validate(Map<String, ? extends @Nullable String> table) {
    table.forEach(
        (key, value) -> {
          Objects.requireNonNull(key, "key");
          // Windows keeps per-drive directories under names such as "=C:"
          if (key.indexOf('=', 1) >= 0 || key.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("Invalid environment variable name: " + key);
          }
          if (value != null && value.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("Invalid environment variable value for: " + key);
          }
        });
  }

  private static StateAccessDeniedException denied(String message, Throwable cause) {
    return new StateAccessDeniedException(message, NAME, cause);
  }
}
