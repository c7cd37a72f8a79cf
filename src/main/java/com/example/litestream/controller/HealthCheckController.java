package com.example.litestream.controller;

import com.example.litestream.config.DataSourceFactory;
import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.routing.LitestreamRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health check endpoints for load balancers and monitoring.
 * Replicas being stale is not an outage: reads fall back to the primary.
 */
@RestController
@RequestMapping("/health")
public class HealthCheckController {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckController.class);

    private final LitestreamRouter router;
    private final DatabaseRegistry registry;
    private final DataSourceFactory dataSourceFactory;

    public HealthCheckController(LitestreamRouter router, DatabaseRegistry registry,
                                 DataSourceFactory dataSourceFactory) {
        this.router = router;
        this.registry = registry;
        this.dataSourceFactory = dataSourceFactory;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * 200 when the primary is reachable, 503 otherwise. Reports which replicas currently
     * qualify for reads.
     */
    @GetMapping("/db")
    public ResponseEntity<Map<String, Object>> databaseStatus() {
        String primaryAlias = router.getPrimaryAlias();
        boolean primaryAvailable = isAvailable(primaryAlias);
        List<String> known = router.replicaAliases();
        List<String> healthy = router.healthyReplicas();

        Map<String, Double> thresholds = new LinkedHashMap<>();
        for (String alias : known) {
            registry.find(alias).ifPresent(settings -> thresholds.put(alias, settings.replica().maxLagSeconds()));
        }

        Map<String, Object> dbStatus = new LinkedHashMap<>();
        dbStatus.put("primary", primaryAvailable ? "HEALTHY" : "UNAVAILABLE");
        dbStatus.put("replicas", known);
        dbStatus.put("healthy_replicas", healthy);
        dbStatus.put("reads_on_primary", healthy.isEmpty());
        dbStatus.put("max_lag_seconds", thresholds);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("database", dbStatus);
        response.put("timestamp", System.currentTimeMillis());

        if (!primaryAvailable) {
            response.put("message", "Primary database is unavailable.");
            return new ResponseEntity<>(response, HttpStatus.SERVICE_UNAVAILABLE);
        }
        response.put("message", healthy.isEmpty()
            ? "No replica within lag threshold, reads use the primary."
            : "All systems operational");
        return ResponseEntity.ok(response);
    }

    /**
     * A primary that cannot even be opened counts as unavailable, not as a server error.
     */
    private boolean isAvailable(String alias) {
        try {
            return dataSourceFactory.isDataSourceAvailable(registry.dataSource(alias));
        } catch (RuntimeException e) {
            log.warn("Database {} could not be opened: {}", alias, e.getMessage());
            return false;
        }
    }
}
