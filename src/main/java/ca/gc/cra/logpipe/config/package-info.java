/**
 * Configuration loading and composition root for log pipelines.
 * <p><strong>Role:</strong> Bootstrap layer turning YAML settings into wired observers.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Metrics:</strong> Selects the OpenTelemetry or no-op metrics adapter.</p>
 */
package ca.gc.cra.logpipe.config;
