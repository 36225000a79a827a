package ca.gc.cra.logpipe.application.filter;

import ca.gc.cra.logpipe.application.port.EventPredicate;
import ca.gc.cra.logpipe.domain.log.InvalidLogLevelException;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Predicate that vetoes events below a per-namespace severity threshold.
 * <p><strong>Resolution:</strong> a namespace resolves to its own entry, else to the entry of the nearest
 * enclosing namespace obtained by dropping whole trailing dot segments ({@code a.b.c} then {@code a.b} then
 * {@code a}), else to the root override, else to the default threshold. The root override is held apart from
 * any entry keyed by the empty string.</p>
 * <p><strong>Decision:</strong> events without a namespace or level are always rejected. Otherwise the result is
 * {@link PredicateResult#NO} when the level is below the threshold and {@link PredicateResult#MAYBE} when it is
 * not; this predicate never answers {@link PredicateResult#YES}.</p>
 * <p><strong>Thread-safety:</strong> not synchronized. Configure before dispatch starts, or guard
 * {@link #setThreshold}, {@link #clear} and {@link #thresholdFor} externally.</p>
 *
 * @since 0.1.0
 */
public final class NamespaceLevelFilter implements EventPredicate {
  /** Threshold used when neither a namespace entry nor a root override applies. */
  public static final LogLevel DEFAULT_THRESHOLD = LogLevel.INFO;

  private final LogLevel defaultThreshold;
  private final Map<String, LogLevel> thresholds = new HashMap<>();
  private LogLevel rootThreshold;

  /**
   * Creates a filter that falls back to {@link #DEFAULT_THRESHOLD}.
   */
  public NamespaceLevelFilter() {
    this(DEFAULT_THRESHOLD);
  }

  /**
   * Creates a filter with its own fallback threshold.
   *
   * @param defaultThreshold threshold used when nothing else matches
   * @throws InvalidLogLevelException when {@code defaultThreshold} is {@code null}
   */
  public NamespaceLevelFilter(LogLevel defaultThreshold) {
    this.defaultThreshold = requireLevel(defaultThreshold);
  }

  /**
   * Sets the threshold for a namespace and, implicitly, for every namespace below it.
   *
   * @param namespace dotted namespace, or {@code null} to set the root override
   * @param level minimum level to let through
   * @throws InvalidLogLevelException when {@code level} is {@code null}; the table is left unchanged
   */
  public void setThreshold(String namespace, LogLevel level) {
    LogLevel checked = requireLevel(level);
    if (namespace == null) {
      rootThreshold = checked;
    } else {
      thresholds.put(namespace, checked);
    }
  }

  /**
   * Sets the root override applied to namespaces without a more specific entry.
   *
   * @param level minimum level to let through
   * @throws InvalidLogLevelException when {@code level} is {@code null}
   */
  public void setRootThreshold(LogLevel level) {
    setThreshold(null, level);
  }

  /**
   * Resolves the effective threshold for {@code namespace}.
   *
   * @param namespace dotted namespace; {@code null} asks for the root threshold
   * @return threshold of the longest matching namespace prefix, the root override, or the default
   */
  public LogLevel thresholdFor(String namespace) {
    if (namespace != null) {
      String candidate = namespace;
      while (true) {
        LogLevel level = thresholds.get(candidate);
        if (level != null) {
          return level;
        }
        int lastDot = candidate.lastIndexOf('.');
        if (lastDot < 0) {
          break;
        }
        candidate = candidate.substring(0, lastDot);
      }
    }
    return rootThreshold != null ? rootThreshold : defaultThreshold;
  }

  /**
   * Removes every namespace entry and the root override.
   */
  public void clear() {
    thresholds.clear();
    rootThreshold = null;
  }

  @Override
  public PredicateResult evaluate(LogEvent event) {
    Optional<String> namespace = event.namespace();
    Optional<LogLevel> level = event.level();
    if (namespace.isEmpty() || level.isEmpty()) {
      return PredicateResult.NO;
    }
    if (level.get().isBelow(thresholdFor(namespace.get()))) {
      return PredicateResult.NO;
    }
    return PredicateResult.MAYBE;
  }

  public LogLevel defaultThreshold() {
    return defaultThreshold;
  }

  /**
   * Returns the root override, if one is set.
   *
   * @return root threshold or empty
   */
  public Optional<LogLevel> rootThreshold() {
    return Optional.ofNullable(rootThreshold);
  }

  /**
   * Returns the explicit namespace entries, excluding the root override.
   *
   * @return unmodifiable snapshot sorted by namespace
   */
  public Map<String, LogLevel> thresholds() {
    Map<String, LogLevel> sorted = new LinkedHashMap<>();
    thresholds.keySet().stream().sorted().forEach(key -> sorted.put(key, thresholds.get(key)));
    return Collections.unmodifiableMap(sorted);
  }

  private static LogLevel requireLevel(LogLevel level) {
    if (level == null) {
      throw new InvalidLogLevelException("Threshold must be a LogLevel constant, got null");
    }
    return level;
  }

  @Override
  public String toString() {
    return "NamespaceLevelFilter[root=" + rootThreshold + ", default=" + defaultThreshold
        + ", namespaces=" + thresholds.size() + "]";
  }
}
