package ca.gc.cra.logpipe.domain.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured log event flowing through the pipeline.
 *
 * <p><strong>What:</strong> an ordered mapping of string keys to arbitrary values. Three keys are reserved:
 * {@value #LEVEL_KEY} (a {@link LogLevel}), {@value #NAMESPACE_KEY} (a {@link String}) and
 * {@value #TRACE_KEY} (an {@link EventTrace}). Any of them may be absent.</p>
 * <p><strong>Lifecycle:</strong> created per log call; fields are fixed at construction. Only the optional
 * trace changes afterwards, growing as the event is forwarded.</p>
 * <p><strong>Thread-safety:</strong> field map is immutable; the trace is not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class LogEvent {
  public static final String LEVEL_KEY = "level";
  public static final String NAMESPACE_KEY = "namespace";
  public static final String TRACE_KEY = "trace";

  private final Map<String, Object> fields;

  private LogEvent(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Creates an event from an existing field map. {@code null} values are kept as explicit entries.
   *
   * @param fields event fields; must not be {@code null}
   * @return new event holding a copy of {@code fields}
   */
  public static LogEvent of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    return new LogEvent(new LinkedHashMap<>(fields));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the raw value stored under {@code key}.
   *
   * @param key field name
   * @return stored value, or {@code null} when absent or explicitly null
   */
  public Object get(String key) {
    return fields.get(key);
  }

  public boolean containsKey(String key) {
    return fields.containsKey(key);
  }

  /**
   * Returns the raw {@value #LEVEL_KEY} value, which may be something other than a {@link LogLevel}
   * when the event was built from an untyped map.
   *
   * @return level value or {@code null}
   */
  public Object rawLevel() {
    return fields.get(LEVEL_KEY);
  }

  /**
   * Returns the event level when the {@value #LEVEL_KEY} field holds a {@link LogLevel}.
   *
   * @return level, or empty when absent, null or not a {@link LogLevel}
   */
  public Optional<LogLevel> level() {
    return fields.get(LEVEL_KEY) instanceof LogLevel level ? Optional.of(level) : Optional.empty();
  }

  /**
   * Returns the event namespace when the {@value #NAMESPACE_KEY} field holds a {@link String}.
   *
   * @return namespace (possibly empty string), or empty when absent or null
   */
  public Optional<String> namespace() {
    return fields.get(NAMESPACE_KEY) instanceof String namespace
        ? Optional.of(namespace)
        : Optional.empty();
  }

  /**
   * Returns the trace carried by this event, if the caller opted in to tracing.
   *
   * @return trace or empty
   */
  public Optional<EventTrace> trace() {
    return fields.get(TRACE_KEY) instanceof EventTrace trace ? Optional.of(trace) : Optional.empty();
  }

  /**
   * Returns every field including reserved ones.
   *
   * @return unmodifiable view of the field map
   */
  public Map<String, Object> fields() {
    return fields;
  }

  @Override
  public String toString() {
    return "LogEvent" + fields;
  }

  /**
   * Fluent builder that preserves insertion order of fields.
   */
  public static final class Builder {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, Object value) {
      fields.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder level(LogLevel level) {
      return put(LEVEL_KEY, level);
    }

    public Builder namespace(String namespace) {
      return put(NAMESPACE_KEY, namespace);
    }

    /**
     * Attaches a fresh, empty trace to the event.
     *
     * @return this builder
     */
    public Builder traced() {
      return put(TRACE_KEY, new EventTrace());
    }

    public Builder trace(EventTrace trace) {
      return put(TRACE_KEY, Objects.requireNonNull(trace, "trace"));
    }

    public LogEvent build() {
      return new LogEvent(new LinkedHashMap<>(fields));
    }
  }
}
