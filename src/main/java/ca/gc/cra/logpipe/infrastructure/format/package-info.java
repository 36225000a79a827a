/**
 * Event-to-text formatters used by sink adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.infrastructure.format;
