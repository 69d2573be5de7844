/**
 * Logging configuration and MDC (Mapped Diagnostic Context) utilities.
 *
 * <p>{@link com.phillippitts.echoscribe.config.logging.MdcFilter} tags every request with a
 * correlation ID; the AI service executor copies the context to worker threads so retried
 * attempts log under the same ID.
 *
 * @since 1.0
 */
package com.phillippitts.echoscribe.config.logging;
