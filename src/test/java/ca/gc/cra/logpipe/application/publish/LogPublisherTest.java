package ca.gc.cra.logpipe.application.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logpipe.application.filter.FilteringObserver;
import ca.gc.cra.logpipe.application.filter.PredicateResult;
import ca.gc.cra.logpipe.application.port.LogObserver;
import ca.gc.cra.logpipe.domain.log.LogEvent;
import ca.gc.cra.logpipe.domain.log.TraceHop;
import ca.gc.cra.logpipe.infrastructure.events.InMemoryLogObserver;
import ca.gc.cra.logpipe.testutil.RecordingMetrics;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogPublisherTest {

  @Test
  void deliversToObserversInRegistrationOrder() {
    List<String> calls = new ArrayList<>();
    LogPublisher publisher = new LogPublisher(
        event -> calls.add("first"),
        event -> calls.add("second"),
        event -> calls.add("third"));

    publisher.deliver(LogEvent.builder().build());

    assertEquals(List.of("first", "second", "third"), calls);
  }

  @Test
  void sameEventInstanceReachesEveryObserver() {
    InMemoryLogObserver a = new InMemoryLogObserver();
    InMemoryLogObserver b = new InMemoryLogObserver();
    LogPublisher publisher = new LogPublisher(a, b);
    LogEvent event = LogEvent.builder().put("k", "v").build();

    publisher.deliver(event);

    assertSame(event, a.snapshot().get(0));
    assertSame(event, b.snapshot().get(0));
  }

  @Test
  void traceRecordsForwardedHopsInTraversalOrder() {
    InMemoryLogObserver sinkYes = new InMemoryLogObserver();
    InMemoryLogObserver sinkNo = new InMemoryLogObserver();
    List<List<TraceHop>> seenByLast = new ArrayList<>();
    FilteringObserver yesFilter = new FilteringObserver(sinkYes, List.of(e -> PredicateResult.YES));
    FilteringObserver noFilter = new FilteringObserver(sinkNo, List.of(e -> PredicateResult.NO));
    LogObserver sinkC = e -> seenByLast.add(e.trace().orElseThrow().hops());
    LogPublisher publisher = new LogPublisher(yesFilter, noFilter, sinkC);
    LogEvent event = LogEvent.builder().traced().build();

    publisher.deliver(event);

    List<TraceHop> expected = List.of(
        new TraceHop(publisher, yesFilter),
        new TraceHop(yesFilter, sinkYes),
        new TraceHop(publisher, noFilter),
        new TraceHop(publisher, sinkC));
    assertEquals(expected, event.trace().orElseThrow().hops());
    assertEquals(List.of(expected), seenByLast);
    assertTrue(sinkNo.snapshot().isEmpty());
  }

  @Test
  void nestedPublishersRecordEveryHop() {
    InMemoryLogObserver leaf = new InMemoryLogObserver();
    LogPublisher inner = new LogPublisher(leaf);
    LogPublisher outer = new LogPublisher(inner);
    LogEvent event = LogEvent.builder().traced().build();

    outer.deliver(event);

    assertEquals(
        List.of(new TraceHop(outer, inner), new TraceHop(inner, leaf)),
        event.trace().orElseThrow().hops());
  }

  @Test
  void untracedEventsAreDeliveredWithoutTrace() {
    InMemoryLogObserver observer = new InMemoryLogObserver();
    LogPublisher publisher = new LogPublisher(observer);

    publisher.deliver(LogEvent.builder().build());

    assertEquals(1, observer.snapshot().size());
    assertTrue(observer.snapshot().get(0).trace().isEmpty());
  }

  @Test
  void failingObserverDoesNotStopDelivery() {
    InMemoryLogObserver before = new InMemoryLogObserver();
    InMemoryLogObserver after = new InMemoryLogObserver();
    LogObserver failing = event -> {
      throw new IllegalStateException("boom");
    };
    RecordingMetrics metrics = new RecordingMetrics();
    LogPublisher publisher = new LogPublisher(List.of(before, failing, after), metrics, "test");
    LogEvent event = LogEvent.builder().traced().build();

    Logger logger = (Logger) LoggerFactory.getLogger(LogPublisher.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      publisher.deliver(event);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1, before.snapshot().size());
    assertEquals(1, after.snapshot().size());
    assertEquals(3, event.trace().orElseThrow().size());
    assertEquals(1L, metrics.counter("test.publisher.delivered"));
    assertEquals(1L, metrics.counter("test.publisher.observer.error"));
    assertEquals(1, appender.list.size());
    ILoggingEvent warning = appender.list.get(0);
    assertEquals(ch.qos.logback.classic.Level.WARN, warning.getLevel());
    assertEquals("boom", warning.getThrowableProxy().getMessage());
  }

  @Test
  void errorsPropagate() {
    InMemoryLogObserver after = new InMemoryLogObserver();
    LogPublisher publisher = new LogPublisher(event -> {
      throw new AssertionError("fatal");
    }, after);

    assertThrows(AssertionError.class, () -> publisher.deliver(LogEvent.builder().build()));
    assertTrue(after.snapshot().isEmpty());
  }

  @Test
  void observersCanBeAddedAndRemoved() {
    InMemoryLogObserver a = new InMemoryLogObserver();
    InMemoryLogObserver b = new InMemoryLogObserver();
    LogPublisher publisher = new LogPublisher(a);

    publisher.addObserver(b);
    publisher.deliver(LogEvent.builder().build());
    assertTrue(publisher.removeObserver(a));
    assertFalse(publisher.removeObserver(a));
    publisher.deliver(LogEvent.builder().build());

    assertEquals(1, a.snapshot().size());
    assertEquals(2, b.snapshot().size());
    assertEquals(List.of(b), publisher.observers());
  }

  @Test
  void observerRemovedDuringDeliveryStillReceivesCurrentEvent() {
    InMemoryLogObserver late = new InMemoryLogObserver();
    LogPublisher publisher = new LogPublisher();
    publisher.addObserver(event -> publisher.removeObserver(late));
    publisher.addObserver(late);

    publisher.deliver(LogEvent.builder().build());
    publisher.deliver(LogEvent.builder().build());

    assertEquals(1, late.snapshot().size());
  }

  @Test
  void nullObserversAreRejected() {
    assertThrows(NullPointerException.class, () -> new LogPublisher((LogObserver) null));
    assertThrows(NullPointerException.class, () -> new LogPublisher().addObserver(null));
  }
}
