/**
 * Translation of domain exceptions into HTTP responses.
 */
package com.phillippitts.echoscribe.presentation.exception;
