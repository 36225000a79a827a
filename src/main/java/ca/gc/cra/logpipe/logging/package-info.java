/**
 * Runtime tuning of the Logback backend.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logpipe.logging;
