package ca.gc.cra.logpipe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logpipe.config.PipelineConfig.CallerStrategy;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import ca.gc.cra.logpipe.infrastructure.bridge.BoundaryCallerLocator;
import ca.gc.cra.logpipe.infrastructure.bridge.LogbackBridgeObserver;
import ca.gc.cra.logpipe.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.logpipe.testutil.LogbackCapture;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineFactoryTest {
  private static final String SINK = "logpipe.test.factory";

  private LogbackCapture capture;

  @BeforeEach
  void setUp() {
    capture = LogbackCapture.attach(SINK, Level.DEBUG);
  }

  @AfterEach
  void tearDown() {
    capture.close();
  }

  @Test
  void eventsFlowThroughThresholdsToSink() {
    try (LogPipeline pipeline = PipelineFactory.create(config(CallerStrategy.DEPTH, null))) {
      pipeline.publisher().deliver(event("app.db", LogLevel.DEBUG, "query {sql}").put("sql", "select 1").build());
      pipeline.publisher().deliver(event("app.web", LogLevel.DEBUG, "hidden").build());
      pipeline.publisher().deliver(event("app.web", LogLevel.WARN, "slow request").build());

      assertEquals(2, capture.events().size());
      ILoggingEvent first = capture.events().get(0);
      assertEquals(Level.DEBUG, first.getLevel());
      assertEquals("query select 1", first.getFormattedMessage());
      assertEquals("slow request", capture.events().get(1).getFormattedMessage());
      assertInstanceOf(NoOpMetricsAdapter.class, pipeline.metrics());
    }
  }

  @Test
  void defaultDepthAttributesPublisherCaller() {
    try (LogPipeline pipeline = PipelineFactory.create(config(CallerStrategy.DEPTH, null))) {
      pipeline.publisher().deliver(event("app", LogLevel.INFO, "hello").build());

      StackTraceElement caller = capture.events().get(0).getCallerData()[0];
      assertEquals(PipelineFactoryTest.class.getName(), caller.getClassName());
      assertEquals("defaultDepthAttributesPublisherCaller", caller.getMethodName());
    }
  }

  @Test
  void boundaryStrategyIsWired() {
    try (LogPipeline pipeline = PipelineFactory.create(config(CallerStrategy.BOUNDARY, null))) {
      assertInstanceOf(BoundaryCallerLocator.class, pipeline.bridge().callerLocator());
    }
  }

  @Test
  void thresholdsCanBeRetunedAtRuntime() {
    try (LogPipeline pipeline = PipelineFactory.create(config(CallerStrategy.NONE, null))) {
      pipeline.publisher().deliver(event("other", LogLevel.INFO, "dropped").build());
      pipeline.levelFilter().setRootThreshold(LogLevel.DEBUG);
      pipeline.publisher().deliver(event("other", LogLevel.INFO, "kept").build());

      assertEquals(1, capture.events().size());
      assertEquals("kept", capture.events().get(0).getFormattedMessage());
    }
  }

  @Test
  void sinkLevelIsAppliedToLogger() {
    try (LogPipeline pipeline = PipelineFactory.create(config(CallerStrategy.NONE, "error"))) {
      assertSame(capture.logger(), pipeline.bridge().sink());
      assertEquals(Level.ERROR, capture.logger().getLevel());

      pipeline.publisher().deliver(event("app.db", LogLevel.WARN, "below sink").build());
      pipeline.publisher().deliver(event("app.db", LogLevel.CRITICAL, "outage").build());

      assertEquals(1, capture.events().size());
      assertTrue(capture.events().get(0).getMarkerList().contains(
          LogbackBridgeObserver.CRITICAL_MARKER));
    }
  }

  @Test
  void invalidSinkSettingsFailBeforeWiring() {
    assertThrows(IllegalArgumentException.class, () -> PipelineFactory.create(config(CallerStrategy.NONE, "chatty")));
    assertThrows(IllegalArgumentException.class, () -> PipelineFactory.create(
        PipelineConfigLoader.parse(Map.of("metrics", Map.of("exporter", "prometheus")))));
    assertEquals(Level.DEBUG, capture.logger().getLevel());
  }

  private static PipelineConfig config(CallerStrategy strategy, String sinkLevel) {
    return new PipelineConfig(
        LogLevel.INFO,
        LogLevel.ERROR,
        Map.of("app", LogLevel.INFO, "app.db", LogLevel.DEBUG),
        SINK,
        strategy,
        PipelineConfig.PIPELINE_STACK_DEPTH,
        sinkLevel,
        "none",
        PipelineConfig.DEFAULT_METRICS_ENDPOINT,
        "test");
  }

  private static LogEvent.Builder event(String namespace, LogLevel level, String format) {
    return LogEvent.builder().namespace(namespace).level(level).put("format", format);
  }
}
