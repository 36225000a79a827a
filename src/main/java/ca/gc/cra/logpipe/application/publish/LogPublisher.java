package ca.gc.cra.logpipe.application.publish;

import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.application.port.MetricsPort;
import ca.gc.cra.logpipe.domain.log.EventTrace;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fan-out observer that hands every event to each registered observer in order.
 * <p><strong>Tracing:</strong> when the event carries a trace, a {@code (this, observer)} hop is appended just
 * before each observer runs, whether or not that observer goes on to forward the event.</p>
 * <p><strong>Failure policy:</strong> observers are isolated from each other. A {@link RuntimeException} from one
 * observer is logged at WARN and counted as {@code <prefix>.publisher.observer.error}; the remaining observers
 * still receive the event. {@link Error}s propagate.</p>
 * <p><strong>Thread-safety:</strong> registration uses a copy-on-write list, so adding or removing observers
 * during a delivery affects only later deliveries.</p>
 *
 * @since 0.1.0
 */
public final class LogPublisher implements LogObserver {
  private static final Logger log = LoggerFactory.getLogger(LogPublisher.class);

  private final CopyOnWriteArrayList<LogObserver> observers;
  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a publisher for the supplied observers.
   *
   * @param observers observers in delivery order
   */
  public LogPublisher(LogObserver... observers) {
    this(Arrays.asList(observers), MetricsPort.NO_OP, "logpipe");
  }

  /**
   * Creates a publisher with metrics.
   *
   * @param observers observers in delivery order; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code logpipe})
   */
  public LogPublisher(List<? extends LogObserver> observers, MetricsPort metrics, String metricPrefix) {
    Objects.requireNonNull(observers, "observers");
    this.observers = new CopyOnWriteArrayList<>();
    for (LogObserver observer : observers) {
      this.observers.add(Objects.requireNonNull(observer, "observer"));
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "logpipe" : metricPrefix.trim();
  }

  /**
   * Appends an observer to the end of the delivery order.
   *
   * @param observer observer to register; must not be {@code null}
   */
  public void addObserver(LogObserver observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  /**
   * Unregisters the first occurrence of {@code observer}.
   *
   * @param observer observer to remove
   * @return {@code true} when the observer was registered
   */
  public boolean removeObserver(LogObserver observer) {
    return observers.remove(observer);
  }

  /**
   * Returns the registered observers in delivery order.
   *
   * @return immutable snapshot
   */
  public List<LogObserver> observers() {
    return List.copyOf(observers);
  }

  @Override
  public void deliver(LogEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".publisher.delivered");
    EventTrace trace = event.trace().orElse(null);
    for (LogObserver observer : observers) {
      if (trace != null) {
        trace.record(this, observer);
      }
      try {
        observer.deliver(event);
      } catch (RuntimeException ex) {
        metrics.increment(metricPrefix + ".publisher.observer.error");
        log.warn("Log observer {} failed; continuing with remaining observers", observer, ex);
      }
    }
  }

  @Override
  public String toString() {
    return "LogPublisher[observers=" + observers.size() + "]";
  }
}
