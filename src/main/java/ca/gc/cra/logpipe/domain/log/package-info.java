/**
 * <strong>Purpose:</strong> Domain model for structured log events: fields, severity and opt-in trace.
 * <p><strong>Pipeline role:</strong> Domain layer shared by filters, publishers and sink bridges.</p>
 * <p><strong>Concurrency:</strong> Event fields are immutable; traces are single-threaded by contract.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.domain.log;
