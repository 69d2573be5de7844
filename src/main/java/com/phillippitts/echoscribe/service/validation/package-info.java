/**
 * Data-driven configuration validation.
 *
 * <p>A {@link com.phillippitts.echoscribe.service.validation.RuleSet} is a static table of
 * {@link com.phillippitts.echoscribe.service.validation.ValidationRule} entries and
 * {@link com.phillippitts.echoscribe.service.validation.CrossFieldCheck} predicates.
 * {@link com.phillippitts.echoscribe.service.validation.ConfigValidator} evaluates any rule set
 * uniformly and returns a {@link com.phillippitts.echoscribe.service.validation.ValidationResult}.
 *
 * @since 1.0
 */
package com.phillippitts.echoscribe.service.validation;
