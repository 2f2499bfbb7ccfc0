package io.github.wphillipmoore.system.override;

import io.github.wphillipmoore.system.override.exception.StateAccessDeniedException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/**
 * {@link SystemStateAccessor} for the JVM system properties.
 *
 * <p>Keys and values are read with {@link String#valueOf}, so non-string entries come back as
 * strings after a restore. Writes install a new {@link Properties} instance through {@link
 * System#setProperties}; code holding a reference to the previous instance does not see the
 * change.
 */
public final class SystemPropertiesAccessor implements SystemStateAccessor {

  static final String NAME = "system properties";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Map<String, String> snapshot() {
    Properties live;
    try {
      live = System.getProperties();
    } catch (SecurityException e) {
      throw new StateAccessDeniedException("Reading system properties was denied", NAME, e);
    }
    return Collections.unmodifiableMap(toStringMap(live));
  }

  @Override
  public void replace(Map<String, ? extends @Nullable String> table) {
    Objects.requireNonNull(table, "table");
    Properties replacement = new Properties();
    table.forEach(
        (key, value) -> {
          if (value != null) {
            replacement.setProperty(key, value);
          }
        });
    try {
      System.setProperties(replacement);
    } catch (SecurityException e) {
      throw new StateAccessDeniedException("Writing system properties was denied", NAME, e);
    }
  }

  /**
   * Copies a {@link Properties} instance into a string map.
   *
   * @param properties the properties to copy, must not be null
   * @return a new mutable map with every entry converted by {@link String#valueOf}
   */
  static Map<String, String> toStringMap(Properties properties) {
    Objects.requireNonNull(properties, "properties");
    Map<String, String> copy = new LinkedHashMap<>();
    properties.forEach((key, value) -> copy.put(String.valueOf(key), String.valueOf(value)));
    return copy;
  }
}
