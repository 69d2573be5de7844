/**
 * Spring configuration: executors, typed properties, settings and logging.
 *
 * <p>Configuration classes are organized as follows:
 * <ul>
 *   <li>{@link com.phillippitts.echoscribe.config.ThreadPoolConfig} - AI service executor</li>
 *   <li>{@link com.phillippitts.echoscribe.config.CorsConfig} - cross-origin access for the frontends</li>
 *   <li>{@code config.properties} - executor sizing</li>
 *   <li>{@code config.settings} - AI services settings snapshot, rule table and startup check</li>
 *   <li>{@code config.logging} - request correlation for structured logs</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.echoscribe.config;
