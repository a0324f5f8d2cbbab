package com.phillippitts.ellie.presentation.controller;

import com.phillippitts.ellie.service.cache.CacheMaintenance;
import com.phillippitts.ellie.service.cache.CacheStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cache")
class CacheController {

    private static final Logger LOG = LogManager.getLogger(CacheController.class);

    private final CacheMaintenance maintenance;

    CacheController(CacheMaintenance maintenance) {
        this.maintenance = maintenance;
    }

    @GetMapping("/stats")
    ResponseEntity<List<CacheStats>> stats() {
        return ResponseEntity.ok(maintenance.stats());
    }

    @PostMapping("/clear")
    ResponseEntity<Map<String, Object>> clear() {
        maintenance.clearAll();
        LOG.info("Response caches cleared on request");
        return ResponseEntity.ok(Map.of("cleared", true));
    }
}
