/**
 * REST controllers. Controllers stay thin and delegate to services in
 * {@code com.phillippitts.echoscribe.service}.
 */
package com.phillippitts.echoscribe.presentation.controller;
