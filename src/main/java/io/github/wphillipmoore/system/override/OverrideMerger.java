package io.github.wphillipmoore.system.override;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Computes the table to apply for an override.
 *
 * <p>Merges desired entries into a snapshot according to a {@link SystemOverrideMode}. The merge is
 * pure: neither input is modified and the result is a new unmodifiable map.
 */
public final class OverrideMerger {

  private OverrideMerger() {}

  /**
   * Merges {@code desired} into {@code original}.
   *
   * <p>Under {@link SystemOverrideMode#ALLOW_OVERRIDE} every desired key is set, or removed when
   * its value is {@code null}. Under {@link SystemOverrideMode#DENY_OVERRIDE} only keys absent from
   * {@code original} with a non-null value are added; removals are ignored.
   *
   * @param original the snapshot to merge into, must not be null
   * @param desired the desired entries, {@code null} values request removal
   * @param mode the merge strategy, must not be null
   * @return unmodifiable merged table without null values, in {@code original} order with new keys
   *     appended
   * @throws NullPointerException if any argument is null
   */
  public static Map<String, String> compute(
      Map<String, String> original,
      Map<String, ? extends @Nullable String> desired,
      SystemOverrideMode mode) {
    Objects.requireNonNull(original, "original");
    Objects.requireNonNull(desired, "desired");
    Objects.requireNonNull(mode, "mode");
    Map<String, String> merged = new LinkedHashMap<>(original);
    if (mode == SystemOverrideMode.ALLOW_OVERRIDE) {
      putReplacing(merged, desired);
    } else {
      putWithoutReplacing(merged, desired);
    }
    return Collections.unmodifiableMap(merged);
  }

  private static void putReplacing(
      Map<String, String> target, Map<String, ? extends @Nullable String> desired) {
    for (Map.Entry<String, ? extends @Nullable String> entry : desired.entrySet()) {
      String value = entry.getValue();
      if (value == null) {
        target.remove(entry.getKey());
      } else {
        target.put(entry.getKey(), value);
      }
    }
  }

  private static void putWithoutReplacing(
      Map<String, String> target, Map<String, ? extends @Nullable String> desired) {
    for (Map.Entry<String, ? extends @Nullable String> entry : desired.entrySet()) {
      String value = entry.getValue();
      if (value != null) {
        target.putIfAbsent(entry.getKey(), value);
      }
    }
  }
}
