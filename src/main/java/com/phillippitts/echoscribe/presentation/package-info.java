/**
 * Presentation layer: REST controllers and error mapping.
 *
 * @since 1.0
 */
package com.phillippitts.echoscribe.presentation;
