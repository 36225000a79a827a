/**
 * Metrics adapters that bridge the pipeline's {@code MetricsPort} to OpenTelemetry or a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Performance:</strong> Instruments are cached per metric key to keep dispatch overhead low.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code <prefix>.publisher.*}, {@code <prefix>.filter.*} and
 * {@code <prefix>.bridge.*}.</p>
 */
package ca.gc.cra.logpipe.infrastructure.metrics;
