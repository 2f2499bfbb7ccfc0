package io.github.wphillipmoore.system.override;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/**
 * Block-scoped overrides of the JVM system properties.
 *
 * <p>Each method changes {@link System#getProperties()} only while {@code block} runs, following
 * the same rules as {@link SystemEnvironment}. The properties are restored when the block returns
 * or throws.
 *
 * <p>System properties are a single process-wide table. Overriding them from several threads at
 * once gives inconsistent results.
 */
public final class SystemProperties {

  private static final ScopedOverride OVERRIDE =
      new ScopedOverride(new SystemPropertiesAccessor());

  private SystemProperties() {}

  /** Overrides one property with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withSystemProperty(
      String key, @Nullable String value, OverrideBlock<T, E> block) throws E {
    return withSystemProperty(key, value, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /**
   * Overrides one property.
   *
   * @param key the property name
   * @param value the value, or {@code null} to remove the property
   * @param mode the merge strategy
   * @param block the work to run
   * @param <T> the result type
   * @param <E> the exception type of the block
   * @return the block's result
   * @throws E if the block fails
   */
  public static <T, E extends Throwable> T withSystemProperty(
      String key, @Nullable String value, SystemOverrideMode mode, OverrideBlock<T, E> block)
      throws E {
    return withSystemProperties(OverrideMaps.of(key, value), mode, block);
  }

  /** Overrides one property given as an entry, with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withSystemProperties(
      Map.Entry<String, ? extends @Nullable String> property, OverrideBlock<T, E> block)
      throws E {
    return withSystemProperties(property, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /** Overrides one property given as an entry. */
  public static <T, E extends Throwable> T withSystemProperties(
      Map.Entry<String, ? extends @Nullable String> property,
      SystemOverrideMode mode,
      OverrideBlock<T, E> block)
      throws E {
    Objects.requireNonNull(property, "property");
    return withSystemProperty(property.getKey(), property.getValue(), mode, block);
  }

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withSystemProperties(
      Properties properties, OverrideBlock<T, E> block) throws E {
    return withSystemProperties(properties, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /** Overrides the given properties. Entries are converted with {@link String#valueOf}. */
  public static <T, E extends Throwable> T withSystemProperties(
      Properties properties, SystemOverrideMode mode, OverrideBlock<T, E> block) throws E {
    return withSystemProperties(OverrideMaps.fromProperties(properties), mode, block);
  }

  /** Overrides several properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withSystemProperties(
      Map<String, ? extends @Nullable String> properties, OverrideBlock<T, E> block) throws E {
    return withSystemProperties(properties, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /**
   * Overrides several properties.
   *
   * @param properties the desired properties, {@code null} values request removal
   * @param mode the merge strategy
   * @param block the work to run
   * @param <T> the result type
   * @param <E> the exception type of the block
   * @return the block's result
   * @throws E if the block fails
   */
  public static <T, E extends Throwable> T withSystemProperties(
      Map<String, ? extends @Nullable String> properties,
      SystemOverrideMode mode,
      OverrideBlock<T, E> block)
      throws E {
    return OVERRIDE.run(properties, mode, block);
  }
}
