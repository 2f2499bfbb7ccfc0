package io.github.wphillipmoore.system.override;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Block-scoped overrides of the process environment.
 *
 * <p>Each method changes the environment seen through {@link System#getenv} only while {@code
 * block} runs. Variables that are not mentioned stay as they are. A {@code null} value removes a
 * variable under {@link SystemOverrideMode#ALLOW_OVERRIDE}; under {@link
 * SystemOverrideMode#DENY_OVERRIDE} existing variables keep their values. The environment is
 * restored when the block returns or throws.
 *
 * <pre>{@code
 * String mode =
 *     SystemEnvironment.withEnvironment("APP_MODE", "test", () -> System.getenv("APP_MODE"));
 * }</pre>
 *
 * <p>The environment is a single process-wide map. Overriding it from several threads at once
 * gives inconsistent results. See {@link EnvironmentAccessor} for the JVM flags this requires.
 */
public final class SystemEnvironment {

  private static final ScopedOverride OVERRIDE = new ScopedOverride(new EnvironmentAccessor());

  private SystemEnvironment() {}

  /** Overrides one variable with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withEnvironment(
      String key, @Nullable String value, OverrideBlock<T, E> block) throws E {
    return withEnvironment(key, value, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /**
   * Overrides one variable.
   *
   * @param key the variable name
   * @param value the value, or {@code null} to remove the variable
   * @param mode the merge strategy
   * @param block the work to run
   * @param <T> the result type
   * @param <E> the exception type of the block
   * @return the block's result
   * @throws E if the block fails
   */
  public static <T, E extends Throwable> T withEnvironment(
      String key, @Nullable String value, SystemOverrideMode mode, OverrideBlock<T, E> block)
      throws E {
    return withEnvironment(OverrideMaps.of(key, value), mode, block);
  }

  /** Overrides one variable given as an entry, with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withEnvironment(
      Map.Entry<String, ? extends @Nullable String> environment, OverrideBlock<T, E> block)
      throws E {
    return withEnvironment(environment, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /** Overrides one variable given as an entry. */
  public static <T, E extends Throwable> T withEnvironment(
      Map.Entry<String, ? extends @Nullable String> environment,
      SystemOverrideMode mode,
      OverrideBlock<T, E> block)
      throws E {
    Objects.requireNonNull(environment, "environment");
    return withEnvironment(environment.getKey(), environment.getValue(), mode, block);
  }

  /** Overrides several variables with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public static <T, E extends Throwable> T withEnvironment(
      Map<String, ? extends @Nullable String> environment, OverrideBlock<T, E> block) throws E {
    return withEnvironment(environment, SystemOverrideMode.ALLOW_OVERRIDE, block);
  }

  /**
   * Overrides several variables.
   *
   * @param environment the desired variables, {@code null} values request removal
   * @param mode the merge strategy
   * @param block the work to run
   * @param <T> the result type
   * @param <E> the exception type of the block
   * @return the block's result
   * @throws E if the block fails
   */
  public static <T, E extends Throwable> T withEnvironment(
      Map<String, ? extends @Nullable String> environment,
      SystemOverrideMode mode,
      OverrideBlock<T, E> block)
      throws E {
    return OVERRIDE.run(environment, mode, block);
  }
}
