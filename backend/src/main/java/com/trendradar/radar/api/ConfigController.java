package com.trendradar.radar.api;

import com.trendradar.radar.isolation.ExecutionIsolationManager;
import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.service.RunValidationException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads and replaces the shared configuration baseline. Writes wait for any in-flight
 * execution to restore first.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigController {
    private final ExecutionIsolationManager isolationManager;

    public ConfigController(ExecutionIsolationManager isolationManager) {
        this.isolationManager = isolationManager;
    }

    @GetMapping
    public ConfigSnapshot currentConfig() {
        return isolationManager.currentBaseline();
    }

    @PutMapping
    public ConfigSnapshot replaceConfig(@RequestBody(required = false) ConfigSnapshot snapshot) {
        if (snapshot == null) {
            throw new RunValidationException("configuration body is required");
        }
        isolationManager.replaceBaseline(snapshot);
        return isolationManager.currentBaseline();
    }
}
