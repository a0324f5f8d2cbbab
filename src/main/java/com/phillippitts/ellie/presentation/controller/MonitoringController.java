package com.phillippitts.ellie.presentation.controller;

import com.phillippitts.ellie.service.fallback.FallbackStats;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Fallback counters and per-provider circuit state.
 */
@RestController
@RequestMapping("/api/monitoring")
class MonitoringController {

    private final ProviderHealthTracker tracker;

    MonitoringController(ProviderHealthTracker tracker) {
        this.tracker = tracker;
    }

    @GetMapping("/fallbacks")
    ResponseEntity<FallbackStats> fallbacks() {
        return ResponseEntity.ok(tracker.stats());
    }
}
