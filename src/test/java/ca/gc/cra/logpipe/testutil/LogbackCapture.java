package ca.gc.cra.logpipe.testutil;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * Attaches a {@link ListAppender} to one Logback logger for the duration of a test.
 */
public final class LogbackCapture implements AutoCloseable {
  private final Logger logger;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final boolean originalAdditive;
  private final Level originalLevel;

  private LogbackCapture(String loggerName, Level level) {
    this.logger = (Logger) LoggerFactory.getLogger(loggerName);
    this.originalAdditive = logger.isAdditive();
    this.originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(level);
    appender.start();
    logger.addAppender(appender);
  }

  public static LogbackCapture attach(String loggerName, Level level) {
    return new LogbackCapture(loggerName, level);
  }

  public Logger logger() {
    return logger;
  }

  public List<ILoggingEvent> events() {
    return appender.list;
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    appender.stop();
  }
}
