package ca.gc.cra.logpipe.application.filter;

/**
 * Thrown when a predicate returns something other than a {@link PredicateResult} constant.
 *
 * @since 0.1.0
 */
public final class InvalidPredicateResultException extends IllegalStateException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public InvalidPredicateResultException(String msg) { super(msg); }
}
