package ca.gc.cra.logpipe.config;

import ca.gc.cra.logpipe.application.filter.NamespaceLevelFilter;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import ca.gc.cra.logpipe.infrastructure.bridge.LogbackBridgeObserver;
import ch.qos.logback.classic.Level;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for a log pipeline.
 *
 * @param defaultThreshold threshold applied when nothing else matches; never {@code null}
 * @param rootThreshold root override; may be {@code null}
 * @param namespaceThresholds per-namespace thresholds in declaration order; never {@code null}
 * @param loggerName Logback logger receiving bridged events; never {@code null}
 * @param callerStrategy how the bridge attributes the calling frame; never {@code null}
 * @param stackDepth caller depth for {@link CallerStrategy#DEPTH}; at least 1
 * @param sinkLevel Logback level name to apply to the sink logger; may be {@code null} to leave it unchanged
 * @param metricsExporter {@code otlp} or {@code none}, case-insensitive; stored lower-case
 * @param metricsEndpoint OTLP endpoint; never {@code null}
 * @param metricPrefix prefix for pipeline counters; never {@code null}
 * @since 0.1.0
 */
public record PipelineConfig(
    LogLevel defaultThreshold,
    LogLevel rootThreshold,
    Map<String, LogLevel> namespaceThresholds,
    String loggerName,
    CallerStrategy callerStrategy,
    int stackDepth,
    String sinkLevel,
    String metricsExporter,
    String metricsEndpoint,
    String metricPrefix) {

  /** Caller depth of a call into {@code LogPublisher -> FilteringObserver -> bridge}. */
  public static final int PIPELINE_STACK_DEPTH = 3;
  public static final String DEFAULT_METRICS_ENDPOINT = "http://localhost:4317";
  public static final String DEFAULT_METRIC_PREFIX = "logpipe";

  public PipelineConfig {
    defaultThreshold = Objects.requireNonNull(defaultThreshold, "defaultThreshold");
    namespaceThresholds = namespaceThresholds == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(namespaceThresholds));
    loggerName = Objects.requireNonNull(loggerName, "loggerName");
    callerStrategy = Objects.requireNonNull(callerStrategy, "callerStrategy");
    if (stackDepth < 1) {
      throw new IllegalArgumentException("bridge.stackDepth must be >= 1");
    }
    if (sinkLevel != null && Level.toLevel(sinkLevel.trim(), null) == null) {
      throw new IllegalArgumentException("bridge.sinkLevel must be a Logback level name, got " + sinkLevel);
    }
    metricsExporter = exporter(Objects.requireNonNull(metricsExporter, "metricsExporter"));
    metricsEndpoint = Objects.requireNonNull(metricsEndpoint, "metricsEndpoint");
    metricPrefix = Objects.requireNonNull(metricPrefix, "metricPrefix");
  }

  /**
   * Returns settings for a pipeline with no overrides and metrics disabled.
   *
   * @return default configuration
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        NamespaceLevelFilter.DEFAULT_THRESHOLD,
        null,
        Map.of(),
        LogbackBridgeObserver.DEFAULT_LOGGER_NAME,
        CallerStrategy.DEPTH,
        PIPELINE_STACK_DEPTH,
        null,
        "none",
        DEFAULT_METRICS_ENDPOINT,
        DEFAULT_METRIC_PREFIX);
  }

  private static String exporter(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metrics.exporter must be otlp or none, got " + raw);
    }
    return normalized;
  }

  /**
   * Caller attribution strategies selectable from configuration.
   */
  public enum CallerStrategy {
    /** Walk a fixed number of frames ({@code bridge.stackDepth}). */
    DEPTH,
    /** Skip the pipeline's own classes. */
    BOUNDARY,
    /** Leave attribution to Logback. */
    NONE;

    static CallerStrategy from(String raw) {
      if (raw == null || raw.isBlank()) {
        return DEPTH;
      }
      String normalized = raw.trim().toUpperCase(Locale.ROOT);
      for (CallerStrategy strategy : values()) {
        if (strategy.name().equals(normalized)) {
          return strategy;
        }
      }
      throw new IllegalArgumentException("bridge.caller must be depth, boundary or none, got " + raw);
    }
  }
}
