package ca.gc.cra.logpipe.config;

import ca.gc.cra.logpipe.application.filter.FilteringObserver;
import ca.gc.cra.logpipe.application.filter.NamespaceLevelFilter;
import ca.gc.cra.logpipe.application.port.CallerLocator;
import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.application.port.MetricsPort;
import ca.gc.cra.logpipe.application.publish.LogPublisher;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import ca.gc.cra.logpipe.infrastructure.bridge.BoundaryCallerLocator;
import ca.gc.cra.logpipe.infrastructure.bridge.LogbackBridgeObserver;
import ca.gc.cra.logpipe.infrastructure.bridge.StackDepthCallerLocator;
import ca.gc.cra.logpipe.infrastructure.format.TemplateEventFormatter;
import ca.gc.cra.logpipe.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.logpipe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logpipe.logging.LoggingConfigurator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root wiring {@code LogPublisher -> FilteringObserver -> LogbackBridgeObserver}.
 * <p><strong>Role:</strong> Bootstrap layer turning a {@link PipelineConfig} into a ready pipeline.</p>
 * <p><strong>Observability:</strong> Logs the resulting threshold table at INFO.</p>
 *
 * @since 0.1.0
 */
public final class PipelineFactory {
  private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

  private PipelineFactory() {}

  /**
   * Builds a pipeline from configuration.
   *
   * @param config pipeline settings; must not be {@code null}
   * @return assembled pipeline
   */
  public static LogPipeline create(PipelineConfig config) {
    Objects.requireNonNull(config, "config");
    MetricsPort metrics = createMetrics(config);

    NamespaceLevelFilter levelFilter = new NamespaceLevelFilter(config.defaultThreshold());
    if (config.rootThreshold() != null) {
      levelFilter.setRootThreshold(config.rootThreshold());
    }
    for (Map.Entry<String, LogLevel> entry : config.namespaceThresholds().entrySet()) {
      levelFilter.setThreshold(entry.getKey(), entry.getValue());
    }

    if (config.sinkLevel() != null) {
      LoggingConfigurator.setLevel(config.loggerName(), config.sinkLevel());
    }
    LogbackBridgeObserver bridge = new LogbackBridgeObserver(
        LogbackBridgeObserver.resolveLogger(config.loggerName()),
        callerLocator(config),
        new TemplateEventFormatter(),
        metrics,
        config.metricPrefix());
    LogObserver filtered = new FilteringObserver(
        bridge, List.of(levelFilter), LogObserver.NO_OP, metrics, config.metricPrefix());
    LogPublisher publisher = new LogPublisher(List.of(filtered), metrics, config.metricPrefix());

    log.info("Log pipeline ready: logger={}, default={}, root={}, namespaces={}",
        config.loggerName(),
        config.defaultThreshold().levelName(),
        config.rootThreshold() == null ? "-" : config.rootThreshold().levelName(),
        config.namespaceThresholds().size());
    return new LogPipeline(publisher, levelFilter, bridge, metrics);
  }

  private static MetricsPort createMetrics(PipelineConfig config) {
    if ("none".equals(config.metricsExporter().toLowerCase(Locale.ROOT))) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.metricsEndpoint());
  }

  private static CallerLocator callerLocator(PipelineConfig config) {
    return switch (config.callerStrategy()) {
      case DEPTH -> new StackDepthCallerLocator(config.stackDepth());
      case BOUNDARY -> BoundaryCallerLocator.forPipeline();
      case NONE -> CallerLocator.NONE;
    };
  }
}
