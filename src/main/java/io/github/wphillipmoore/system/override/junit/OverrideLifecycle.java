package io.github.wphillipmoore.system.override.junit;

import io.github.wphillipmoore.system.override.OverrideMaps;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared before/after logic of the lifecycle adapters.
 *
 * <p>{@link #beforeScope()} applies the override and keeps the snapshot; {@link #afterScope()}
 * restores it. The snapshot is instance state, so one adapter instance must not be used for two
 * overlapping scopes.
 */
public abstract class OverrideLifecycle {

  private static final Logger LOG = LoggerFactory.getLogger(OverrideLifecycle.class);

  private final ScopedOverride override;
  private final Map<String, @Nullable String> desired;
  private final SystemOverrideMode mode;
  private @Nullable Map<String, String> original;

  /**
   * Creates a lifecycle for the given override.
   *
   * @param override the scoped override for the target table, must not be null
   * @param desired the desired entries, {@code null} values request removal
   * @param mode the merge strategy, must not be null
   */
  protected OverrideLifecycle(
      ScopedOverride override,
      Map<String, ? extends @Nullable String> desired,
      SystemOverrideMode mode) {
    this.override = Objects.requireNonNull(override, "override");
    this.desired =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(desired, "desired")));
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  /** Returns the desired entries. The returned map is unmodifiable. */
  public Map<String, @Nullable String> getDesired() {
    return desired;
  }

  /** Returns the merge strategy. */
  public SystemOverrideMode getMode() {
    return mode;
  }

  /** Returns whether the override is currently applied by this instance. */
  public boolean isApplied() {
    return original != null;
  }

  /** Applies the override and keeps the snapshot for {@link #afterScope()}. */
  protected void beforeScope() {
    if (original != null) {
      throw new IllegalStateException(
          "Override of " + override.getAccessor().name() + " is already applied");
    }
    original = override.apply(desired, mode);
  }

  /** Restores the snapshot kept by {@link #beforeScope()}, if any. */
  protected void afterScope() {
    Map<String, String> snapshot = original;
    if (snapshot == null) {
      LOG.warn(
          "No {} override to restore; the before callback did not complete",
          override.getAccessor().name());
      return;
    }
    original = null;
    override.restore(snapshot);
  }

  static Map<String, @Nullable String> single(String key, @Nullable String value) {
    return OverrideMaps.of(key, value);
  }

  static Map<String, @Nullable String> entries(
      List<? extends Map.Entry<String, ? extends @Nullable String>> entries) {
    return OverrideMaps.fromEntries(entries);
  }
}
