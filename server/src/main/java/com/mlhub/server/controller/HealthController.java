package com.mlhub.server.controller;

import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.api.HealthReport;
import com.mlhub.server.service.ModelCacheService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final ModelCacheService modelCache;
    private final BackendRegistry backendRegistry;

    public HealthController(ModelCacheService modelCache, BackendRegistry backendRegistry) {
        this.modelCache = modelCache;
        this.backendRegistry = backendRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        return ResponseEntity.ok(new HealthReport("ok", modelCache.size(), backendRegistry.availableBackends()));
    }
}
