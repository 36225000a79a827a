package ca.gc.cra.logpipe.application.port;

import ca.gc.cra.logpipe.application.filter.PredicateResult;
import ca.gc.cra.logpipe.domain.log.LogEvent;

/**
 * Decision function consulted by a {@code FilteringObserver}.
 *
 * <p>Implementations should be free of side effects and must return one of the
 * {@link PredicateResult} constants; {@code null} is rejected by the caller.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventPredicate {
  /**
   * Classifies an event.
   *
   * @param event event under consideration; never {@code null}
   * @return {@link PredicateResult#YES} to force delivery, {@link PredicateResult#NO} to drop it, or
   *     {@link PredicateResult#MAYBE} to defer to later predicates
   */
  PredicateResult evaluate(LogEvent event);
}
