/**
 * Fan-out dispatch of log events to registered observers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.application.publish;
