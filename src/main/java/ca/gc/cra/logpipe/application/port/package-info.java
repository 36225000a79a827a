/**
 * <strong>Purpose:</strong> Capability interfaces that the log pipeline composes: observers, predicates,
 * formatters, caller locators and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code infrastructure} implement these.</p>
 * <p><strong>Concurrency:</strong> Dispatch is synchronous; port contracts carry no threading of their own.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.application.port;
