package ca.gc.cra.logpipe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogEventTest {

  @Test
  void reservedKeysAreExposedThroughTypedAccessors() {
    LogEvent event = LogEvent.builder()
        .namespace("billing.invoices")
        .level(LogLevel.WARN)
        .put("invoice", 42)
        .build();

    assertEquals("billing.invoices", event.namespace().orElseThrow());
    assertEquals(LogLevel.WARN, event.level().orElseThrow());
    assertEquals(42, event.get("invoice"));
    assertTrue(event.trace().isEmpty());
  }

  @Test
  void levelNameStringIsNotALevel() {
    Map<String, Object> fields = new HashMap<>();
    fields.put(LogEvent.LEVEL_KEY, "debug");
    fields.put(LogEvent.NAMESPACE_KEY, null);
    LogEvent event = LogEvent.of(fields);

    assertTrue(event.level().isEmpty());
    assertEquals("debug", event.rawLevel());
    assertTrue(event.namespace().isEmpty());
    assertTrue(event.containsKey(LogEvent.NAMESPACE_KEY));
    assertNull(event.get(LogEvent.NAMESPACE_KEY));
  }

  @Test
  void emptyNamespaceIsPresent() {
    LogEvent event = LogEvent.builder().namespace("").build();

    assertEquals("", event.namespace().orElseThrow());
  }

  @Test
  void traceAccumulatesHopsInOrder() {
    EventTrace trace = new EventTrace();
    LogEvent event = LogEvent.builder().trace(trace).build();
    Object a = new Object();
    Object b = new Object();

    event.trace().orElseThrow().record(a, b);
    event.trace().orElseThrow().record(b, a);

    assertSame(trace, event.get(LogEvent.TRACE_KEY));
    assertEquals(List.of(new TraceHop(a, b), new TraceHop(b, a)), trace.hops());
  }

  @Test
  void fieldsAreImmutable() {
    LogEvent event = LogEvent.builder().put("k", "v").build();

    assertThrows(UnsupportedOperationException.class, () -> event.fields().put("other", 1));
  }
}
