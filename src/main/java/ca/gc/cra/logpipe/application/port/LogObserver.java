package ca.gc.cra.logpipe.application.port;

import ca.gc.cra.logpipe.domain.log.LogEvent;

/**
 * <strong>What:</strong> Capability for anything that consumes log events.
 * <p><strong>Why:</strong> Publishers, filters and sink bridges compose through this single method, so any of
 * them can wrap any other.</p>
 * <p><strong>Role:</strong> Outbound port; implemented by {@code LogPublisher}, {@code FilteringObserver},
 * sink adapters and test doubles.</p>
 * <p><strong>Thread-safety:</strong> Delivery is synchronous; implementations document their own guarantees.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogObserver {
  /**
   * Consumes one event. Returns only after the event has been fully handled downstream.
   *
   * @param event event to handle; never {@code null}
   */
  void deliver(LogEvent event);

  /**
   * Observer that ignores every event.
   */
  LogObserver NO_OP = event -> {};
}
