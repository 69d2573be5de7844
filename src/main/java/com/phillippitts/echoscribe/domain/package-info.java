/**
 * Request and result types of the meeting-analysis operations.
 */
package com.phillippitts.echoscribe.domain;
