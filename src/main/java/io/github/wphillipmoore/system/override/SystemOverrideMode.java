package io.github.wphillipmoore.system.override;

/**
 * Strategy for merging desired overrides into a snapshot of a system table.
 *
 * <p>Controls whether desired entries may replace or remove keys that already exist in the
 * environment or system properties.
 */
public enum SystemOverrideMode {

  /** Desired entries replace existing keys, and a {@code null} value removes the key. */
  ALLOW_OVERRIDE,

  /** Desired entries are only added when absent. Existing keys and removals are left alone. */
  DENY_OVERRIDE
}
