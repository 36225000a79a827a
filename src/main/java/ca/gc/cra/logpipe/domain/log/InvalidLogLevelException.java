package ca.gc.cra.logpipe.domain.log;

/**
 * Thrown when a value that is not a {@link LogLevel} is supplied where a level is required.
 *
 * @since 0.1.0
 */
public final class InvalidLogLevelException extends IllegalArgumentException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public InvalidLogLevelException(String msg) { super(msg); }
}
