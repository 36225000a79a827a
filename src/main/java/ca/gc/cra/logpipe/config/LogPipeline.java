package ca.gc.cra.logpipe.config;

import ca.gc.cra.logpipe.application.filter.NamespaceLevelFilter;
import ca.gc.cra.logpipe.application.port.MetricsPort;
import ca.gc.cra.logpipe.application.publish.LogPublisher;
import ca.gc.cra.logpipe.infrastructure.bridge.LogbackBridgeObserver;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembled pipeline returned by {@link PipelineFactory}.
 *
 * <p>Callers deliver events to {@link #publisher()} and may retune {@link #levelFilter()} at runtime. Closing the
 * pipeline releases the metrics adapter when it holds resources.</p>
 *
 * @param publisher entry point of the pipeline; never {@code null}
 * @param levelFilter namespace threshold predicate guarding the bridge; never {@code null}
 * @param bridge Logback sink adapter; never {@code null}
 * @param metrics metrics adapter shared by all stages; never {@code null}
 * @since 0.1.0
 */
public record LogPipeline(
    LogPublisher publisher,
    NamespaceLevelFilter levelFilter,
    LogbackBridgeObserver bridge,
    MetricsPort metrics) implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LogPipeline.class);

  public LogPipeline {
    publisher = Objects.requireNonNull(publisher, "publisher");
    levelFilter = Objects.requireNonNull(levelFilter, "levelFilter");
    bridge = Objects.requireNonNull(bridge, "bridge");
    metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}
