package io.github.wphillipmoore.system.override;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Read and replace access to one process-wide string table.
 *
 * <p>Implementations address the environment ({@link EnvironmentAccessor}) or the system
 * properties ({@link SystemPropertiesAccessor}). Both should throw {@link
 * io.github.wphillipmoore.system.override.exception.StateAccessDeniedException} when the platform
 * refuses access.
 */
public interface SystemStateAccessor {

  /**
   * Returns a short name for the table, used in log and exception messages.
   *
   * @return the table name (e.g. "environment")
   */
  String name();

  /**
   * Captures the whole live table.
   *
   * @return an unmodifiable copy that later changes to the live table do not affect
   */
  Map<String, String> snapshot();

  /**
   * Clears the live table and fills it from {@code table}. Entries with a {@code null} value are
   * skipped.
   *
   * @param table the complete new table
   */
  void replace(Map<String, ? extends @Nullable String> table);
}
