package ca.gc.cra.logpipe.infrastructure.bridge;

import ca.gc.cra.logpipe.application.port.EventFormatter;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import java.util.Objects;

/**
 * Log message argument that formats its event only when the sink asks for text.
 *
 * <p>Logback renders arguments through {@link #toString()} when an appender needs the formatted message;
 * records dropped before that point never pay for formatting. The rendered text is cached, so the
 * formatter runs at most once per instance.</p>
 *
 * @since 0.1.0
 */
public final class DeferredEventMessage {
  private final LogEvent event;
  private final EventFormatter formatter;
  private String rendered;

  DeferredEventMessage(LogEvent event, EventFormatter formatter) {
    this.event = Objects.requireNonNull(event, "event");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  public LogEvent event() {
    return event;
  }

  /**
   * Indicates whether the event has been formatted yet.
   *
   * @return {@code true} once {@link #toString()} has run
   */
  public boolean isRendered() {
    return rendered != null;
  }

  @Override
  public String toString() {
    if (rendered == null) {
      rendered = formatter.format(event);
    }
    return rendered;
  }
}
