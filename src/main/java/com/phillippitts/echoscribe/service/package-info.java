/**
 * Service layer.
 *
 * <ul>
 *   <li>{@code service.retry} - retries asynchronous AI operations with exponential backoff</li>
 *   <li>{@code service.validation} - rule-table configuration validation</li>
 *   <li>{@code service.analysis} - meeting-analysis operations</li>
 *   <li>{@code service.health} - actuator health indicators</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 */
package com.phillippitts.echoscribe.service;
