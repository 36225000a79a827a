package ca.gc.cra.logpipe.application.port;

import ca.gc.cra.logpipe.domain.log.LogEvent;

/**
 * Renders an event as human-readable text.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventFormatter {
  /**
   * Formats the event.
   *
   * @param event event to render; never {@code null}
   * @return rendered text; never {@code null}
   */
  String format(LogEvent event);
}
