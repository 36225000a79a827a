package ca.gc.cra.logpipe.infrastructure.format;

import ca.gc.cra.logpipe.application.port.EventFormatter;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import java.util.Objects;

/**
 * Formats events from a template held in the event itself.
 *
 * <p>The template is the {@value #FORMAT_KEY} field. {@code {name}} is replaced by the value of field
 * {@code name}, and {@code {{} and {@code }}} produce literal braces. Events without a template render as the
 * empty string. A template that names a missing field or is not well formed renders as
 * {@code "Unable to format event ..."} rather than failing, since formatting happens inside the sink.</p>
 *
 * @since 0.1.0
 */
public final class TemplateEventFormatter implements EventFormatter {
  /** Field holding the message template. */
  public static final String FORMAT_KEY = "format";

  @Override
  public String format(LogEvent event) {
    Objects.requireNonNull(event, "event");
    Object template = event.get(FORMAT_KEY);
    if (template == null) {
      return "";
    }
    try {
      return render(template.toString(), event);
    } catch (IllegalArgumentException ex) {
      return "Unable to format event " + event.fields() + ": " + ex.getMessage();
    }
  }

  private static String render(String template, LogEvent event) {
    StringBuilder out = new StringBuilder(template.length() + 16);
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '{') {
        if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
          out.append('{');
          i += 2;
          continue;
        }
        int close = template.indexOf('}', i + 1);
        if (close < 0) {
          throw new IllegalArgumentException("unclosed '{' at offset " + i);
        }
        String key = template.substring(i + 1, close);
        if (!event.containsKey(key)) {
          throw new IllegalArgumentException("missing field '" + key + "'");
        }
        out.append(event.get(key));
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
          out.append('}');
          i += 2;
          continue;
        }
        throw new IllegalArgumentException("single '}' at offset " + i);
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }
}
