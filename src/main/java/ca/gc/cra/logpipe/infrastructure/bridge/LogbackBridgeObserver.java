package ca.gc.cra.logpipe.infrastructure.bridge;

import ca.gc.cra.logpipe.application.port.CallerLocator;
import ca.gc.cra.logpipe.application.port.EventFormatter;
import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.application.port.MetricsPort;
import ca.gc.cra.logpipe.domain.log.CallerFrame;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import ca.gc.cra.logpipe.infrastructure.format.TemplateEventFormatter;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * <strong>What:</strong> Terminal observer that writes pipeline events to a Logback logger.
 * <p><strong>Why:</strong> Lets applications keep their Logback appenders, encoders and level configuration while
 * structured events flow through the pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map the event level onto Logback; absent or unknown levels log at INFO and CRITICAL adds a
 *       {@code CRITICAL} marker.</li>
 *   <li>Skip events the sink logger's own level would discard.</li>
 *   <li>Pass a {@link DeferredEventMessage} so formatting happens only when an appender renders text.</li>
 *   <li>Set the record's caller data to the frame resolved by the {@link CallerLocator}.</li>
 * </ul>
 * <p><strong>Blocking:</strong> appenders run on the delivering thread. A blocking appender (for example a
 * synchronous socket appender) blocks the whole pipeline; configure Logback with non-blocking appenders.</p>
 * <p><strong>Metrics:</strong> counters {@code <prefix>.bridge.emitted} and {@code <prefix>.bridge.suppressed}; time
 * spent in the sink's appenders is observed as {@code <prefix>.bridge.append_nanos}.</p>
 *
 * @implNote Records go straight to {@link Logger#callAppenders}, so Logback turbo filters do not apply.
 * @since 0.1.0
 */
public final class LogbackBridgeObserver implements LogObserver {
  /** Sink logger used when none is configured. */
  public static final String DEFAULT_LOGGER_NAME = "logpipe";

  /** Marker added to records of CRITICAL events, which Logback logs at ERROR. */
  public static final Marker CRITICAL_MARKER = MarkerFactory.getMarker("CRITICAL");
  private static final String FQCN = LogbackBridgeObserver.class.getName();

  private final Logger sink;
  private final CallerLocator callerLocator;
  private final EventFormatter formatter;
  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a bridge to the {@value #DEFAULT_LOGGER_NAME} logger for direct calls.
   */
  public LogbackBridgeObserver() {
    this(DEFAULT_LOGGER_NAME, StackDepthCallerLocator.DEFAULT_STACK_DEPTH);
  }

  /**
   * Creates a bridge attributing calls {@code stackDepth} frames above its delivery method.
   *
   * @param loggerName Logback logger receiving the records; must not be {@code null}
   * @param stackDepth caller depth, see {@link StackDepthCallerLocator}
   */
  public LogbackBridgeObserver(String loggerName, int stackDepth) {
    this(resolveLogger(loggerName), new StackDepthCallerLocator(stackDepth), new TemplateEventFormatter(),
        MetricsPort.NO_OP, "logpipe");
  }

  /**
   * Creates a bridge with every collaborator supplied.
   *
   * @param sink Logback logger receiving the records; must not be {@code null}
   * @param callerLocator caller attribution strategy; falls back to {@link CallerLocator#NONE}
   * @param formatter event formatter; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters
   */
  public LogbackBridgeObserver(
      Logger sink,
      CallerLocator callerLocator,
      EventFormatter formatter,
      MetricsPort metrics,
      String metricPrefix) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.callerLocator = callerLocator == null ? CallerLocator.NONE : callerLocator;
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "logpipe" : metricPrefix.trim();
  }

  /**
   * Looks up a Logback logger through SLF4J.
   *
   * @param loggerName logger name; must not be {@code null}
   * @return Logback logger
   * @throws IllegalStateException when the active SLF4J backend is not Logback
   */
  public static Logger resolveLogger(String loggerName) {
    Objects.requireNonNull(loggerName, "loggerName");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(loggerName);
    }
    throw new IllegalStateException(
        "Logback bridge requires logback-classic as the SLF4J backend, found " + factory.getClass().getName());
  }

  @Override
  public void deliver(LogEvent event) {
    Objects.requireNonNull(event, "event");
    Level level = LogbackLevels.toLogback(event.rawLevel());
    if (!sink.isEnabledFor(level)) {
      metrics.increment(metricPrefix + ".bridge.suppressed");
      return;
    }
    Optional<CallerFrame> caller = callerLocator.locate();
    LoggingEvent record = new LoggingEvent(
        FQCN, sink, level, "{}", null, new Object[] {new DeferredEventMessage(event, formatter)});
    if (event.rawLevel() == LogLevel.CRITICAL) {
      record.addMarker(CRITICAL_MARKER);
    }
    if (caller.isPresent()) {
      record.setCallerData(new StackTraceElement[] {caller.get().toStackTraceElement()});
    }
    long started = System.nanoTime();
    sink.callAppenders(record);
    metrics.observe(metricPrefix + ".bridge.append_nanos", System.nanoTime() - started);
    metrics.increment(metricPrefix + ".bridge.emitted");
  }

  public Logger sink() {
    return sink;
  }

  public CallerLocator callerLocator() {
    return callerLocator;
  }

  @Override
  public String toString() {
    return "LogbackBridgeObserver[" + sink.getName() + "]";
  }
}
