/**
 * Retry with bounded exponential backoff.
 *
 * <p>{@link com.phillippitts.echoscribe.service.retry.RetryExecutor} takes the work as a
 * {@code Supplier} of a {@code CompletionStage}, so any service can retry any asynchronous call
 * without subclassing. Backoff waits go through
 * {@link com.phillippitts.echoscribe.service.retry.DelayScheduler} and never block a thread.
 *
 * <p>Retried work must be idempotent.
 *
 * @since 1.0
 */
package com.phillippitts.echoscribe.service.retry;
