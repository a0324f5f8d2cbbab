package com.phillippitts.ellie.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness probe for load balancers and the client's reachability check. The request passes
 * through the MDC filter, so its log line carries the request id.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.debug("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().toString()
        ));
    }
}
