/**
 * AI services settings and their validation.
 *
 * <p>{@link com.phillippitts.echoscribe.config.settings.AiServiceSettings} is the immutable
 * configuration snapshot, {@link com.phillippitts.echoscribe.config.settings.AiServiceRules}
 * the rule table that checks it. Startup behavior on invalid settings is chosen through
 * {@link com.phillippitts.echoscribe.config.settings.StartupValidationProperties}.
 */
package com.phillippitts.echoscribe.config.settings;
