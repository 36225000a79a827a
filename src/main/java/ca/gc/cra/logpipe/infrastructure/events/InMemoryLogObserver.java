package ca.gc.cra.logpipe.infrastructure.events;

import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory observer used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryLogObserver implements LogObserver {
  private final CopyOnWriteArrayList<LogEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void deliver(LogEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of delivered events.
   *
   * @return immutable list of events in delivery order
   */
  public List<LogEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
