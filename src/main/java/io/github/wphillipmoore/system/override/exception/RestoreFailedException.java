package io.github.wphillipmoore.system.override.exception;

/**
 * Thrown when a table could not be restored to its snapshot after an override.
 *
 * <p>The table is left in an unknown state, so this failure is always fatal. When the overridden
 * block had already failed, that failure is attached as a suppressed exception.
 */
public final class RestoreFailedException extends SystemOverrideException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a restore failure.
   *
   * @param message description of the failure
   * @param table the name of the table being restored
   * @param cause the underlying cause
   */
  public RestoreFailedException(String message, String table, Throwable cause) {
    super(message, table, cause);
  }
}
