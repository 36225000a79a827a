package ca.gc.cra.logpipe.application.filter;

/**
 * Tri-state outcome of an {@link ca.gc.cra.logpipe.application.port.EventPredicate}.
 *
 * @since 0.1.0
 */
public enum PredicateResult {
  /** Deliver the event without consulting further predicates. */
  YES,
  /** Drop the event without consulting further predicates. */
  NO,
  /** No opinion; the next predicate decides, and delivery happens if none objects. */
  MAYBE
}
