/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.echoscribe.exception.EchoScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.echoscribe.exception.AiServiceException} - An AI operation
 *       failed; carries the operation name</li>
 *   <li>{@link com.phillippitts.echoscribe.exception.RetryExhaustedException} - All retry
 *       attempts failed; carries attempt count and last cause</li>
 *   <li>{@link com.phillippitts.echoscribe.exception.RetryCancelledException} - A retry
 *       sequence was cancelled or timed out</li>
 *   <li>{@link com.phillippitts.echoscribe.exception.ConfigurationValidationException} -
 *       Startup configuration is invalid and the failure policy requires an abort</li>
 *   <li>{@link com.phillippitts.echoscribe.exception.InvalidInputException} - Request input
 *       failed validation</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.echoscribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.echoscribe.exception;
