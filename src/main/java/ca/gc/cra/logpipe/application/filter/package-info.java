/**
 * <strong>Purpose:</strong> Event filtering: tri-state predicates, the filtering decorator and the
 * namespace severity threshold predicate.
 * <p><strong>Pipeline role:</strong> Application layer sitting between publishers and sink adapters.</p>
 * <p><strong>Concurrency:</strong> Synchronous evaluation; threshold tables are unsynchronized.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.application.filter;
