package io.github.wphillipmoore.system.override.exception;

/**
 * Thrown when the platform refuses a read or write of the environment or system properties.
 *
 * <p>Typical causes are a missing {@code --add-opens} flag for the JDK's private environment maps
 * or a security manager that forbids {@link System#setProperties}. Access failures are not
 * retried.
 */
public final class StateAccessDeniedException extends SystemOverrideException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an access-denied exception.
   *
   * @param message description of the failure
   * @param table the name of the table being accessed
   * @param cause the underlying cause
   */
  public StateAccessDeniedException(String message, String table, Throwable cause) {
    super(message, table, cause);
  }
}
