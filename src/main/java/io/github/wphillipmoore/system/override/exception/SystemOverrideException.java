package io.github.wphillipmoore.system.override.exception;

import java.util.Objects;

/**
 * Base exception for failures while overriding or restoring a system table.
 *
 * <p>This is an unchecked exception hierarchy. Failures raised by the caller's own block of work
 * are never wrapped in it; they propagate unchanged.
 */
public sealed class SystemOverrideException extends RuntimeException
    permits StateAccessDeniedException, RestoreFailedException {

  private static final long serialVersionUID = 1L;

  private final String table;

  /**
   * Creates an exception with the given message and cause.
   *
   * @param message description of the failure
   * @param table the name of the table being accessed (e.g. "environment")
   * @param cause the underlying cause
   */
  public SystemOverrideException(String message, String table, Throwable cause) {
    super(message, cause);
    this.table = Objects.requireNonNull(table, "table");
  }

  /** Returns the name of the table that was being accessed when the failure occurred. */
  public String getTable() {
    return table;
  }
}
