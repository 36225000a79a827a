/**
 * <strong>Purpose:</strong> Adapters that hand accepted pipeline events to Logback.
 * <p><strong>Pipeline role:</strong> Terminal sink adapters plus caller attribution strategies.</p>
 * <p><strong>Concurrency:</strong> Runs on the delivering thread; Logback appenders provide their own locking.</p>
 * <p><strong>Performance:</strong> Level-gated before any record is built; message formatting is deferred.</p>
 * <p><strong>Observability:</strong> Counts emitted and suppressed records through {@code MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.infrastructure.bridge;
