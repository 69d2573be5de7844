package com.phillippitts.echoscribe.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Service banner. Also a cheap way to produce a request that traverses the MDC filter.
 */
@RestController
class RootController {

    private static final Logger log = LogManager.getLogger(RootController.class);

    private final String version;

    RootController(@Value("${echoscribe.version:1.0.0}") String version) {
        this.version = version;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        log.info("Root endpoint requested");
        return ResponseEntity.ok(Map.of(
                "message", "EchoScribe AI Services",
                "version", version,
                "status", "running"
        ));
    }
}
