package ca.gc.cra.logpipe.application.filter;

import ca.gc.cra.logpipe.application.port.EventPredicate;
import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.application.port.MetricsPort;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Observer decorator that forwards an event to its target only when an ordered chain of
 * predicates allows it.
 * <p><strong>Decision:</strong> predicates run in order. {@link PredicateResult#NO} drops the event and
 * {@link PredicateResult#YES} forwards it, both without evaluating the rest. {@link PredicateResult#MAYBE}
 * moves on; a chain of only {@code MAYBE} (or no predicates at all) forwards.</p>
 * <p><strong>Tracing:</strong> a forwarded event that carries a trace gets a {@code (this, target)} hop
 * before the target runs. Dropped events get no hop and go to the rejected-event observer instead.</p>
 * <p><strong>Thread-safety:</strong> immutable after construction; thread-safety follows the predicates and
 * target.</p>
 * <p><strong>Metrics:</strong> {@code <prefix>.filter.forwarded} and {@code <prefix>.filter.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class FilteringObserver implements LogObserver {
  private static final Logger log = LoggerFactory.getLogger(FilteringObserver.class);

  private final LogObserver target;
  private final List<EventPredicate> predicates;
  private final LogObserver rejectedObserver;
  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a filtering observer that discards rejected events.
   *
   * @param target observer receiving accepted events; must not be {@code null}
   * @param predicates predicates in evaluation order; must not be {@code null}
   */
  public FilteringObserver(LogObserver target, List<? extends EventPredicate> predicates) {
    this(target, predicates, LogObserver.NO_OP, MetricsPort.NO_OP, "logpipe");
  }

  /**
   * Creates a filtering observer with every collaborator supplied.
   *
   * @param target observer receiving accepted events; must not be {@code null}
   * @param predicates predicates in evaluation order; must not be {@code null}
   * @param rejectedObserver observer receiving dropped events; falls back to {@link LogObserver#NO_OP}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code logpipe})
   */
  public FilteringObserver(
      LogObserver target,
      List<? extends EventPredicate> predicates,
      LogObserver rejectedObserver,
      MetricsPort metrics,
      String metricPrefix) {
    this.target = Objects.requireNonNull(target, "target");
    this.predicates = List.copyOf(Objects.requireNonNull(predicates, "predicates"));
    this.rejectedObserver = rejectedObserver == null ? LogObserver.NO_OP : rejectedObserver;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "logpipe" : metricPrefix.trim();
  }

  @Override
  public void deliver(LogEvent event) {
    Objects.requireNonNull(event, "event");
    if (shouldForward(event)) {
      metrics.increment(metricPrefix + ".filter.forwarded");
      event.trace().ifPresent(trace -> trace.record(this, target));
      target.deliver(event);
    } else {
      metrics.increment(metricPrefix + ".filter.dropped");
      rejectedObserver.deliver(event);
    }
  }

  /**
   * Runs the predicate chain against {@code event}.
   *
   * @param event event to classify
   * @return {@code true} when the event should reach the target
   * @throws InvalidPredicateResultException when a predicate returns {@code null}
   */
  boolean shouldForward(LogEvent event) {
    for (EventPredicate predicate : predicates) {
      PredicateResult result = predicate.evaluate(event);
      if (result == null) {
        throw new InvalidPredicateResultException(
            "Predicate " + predicate + " returned null; expected YES, NO or MAYBE");
      }
      switch (result) {
        case YES -> {
          return true;
        }
        case NO -> {
          log.trace("Predicate {} rejected {}", predicate, event);
          return false;
        }
        case MAYBE -> {
          // next predicate decides
        }
      }
    }
    return true;
  }

  public LogObserver target() {
    return target;
  }

  public List<EventPredicate> predicates() {
    return predicates;
  }

  @Override
  public String toString() {
    return "FilteringObserver[target=" + target + ", predicates=" + predicates.size() + "]";
  }
}
