package com.example.litestream.controller;

import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.config.LitestreamConfigGenerator;
import com.example.litestream.replica.ReplicaStatus;
import com.example.litestream.replica.ReplicaStatusProber;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for replica status and the generated Litestream configuration.
 */
@RestController
@RequestMapping("/api/db")
public class DatabaseMonitoringController {

    private final DatabaseRegistry registry;
    private final ReplicaStatusProber prober;
    private final LitestreamConfigGenerator configGenerator;

    public DatabaseMonitoringController(DatabaseRegistry registry, ReplicaStatusProber prober,
                                        LitestreamConfigGenerator configGenerator) {
        this.registry = registry;
        this.prober = prober;
        this.configGenerator = configGenerator;
    }

    /**
     * Status of every configured replica, with whether it is within its lag threshold.
     */
    @GetMapping("/replicas")
    public ResponseEntity<List<Map<String, Object>>> getReplicas() {
        List<Map<String, Object>> replicas = new ArrayList<>();
        for (String alias : registry.replicaAliases()) {
            ReplicaStatus status = prober.probe(alias);
            double maxLag = registry.replicaSettings(alias).replica().maxLagSeconds();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", status);
            entry.put("max_lag_seconds", maxLag);
            entry.put("healthy", status.isWithin(maxLag));
            replicas.add(entry);
        }
        return ResponseEntity.ok(replicas);
    }

    /**
     * Status of one replica. 404 for an unknown alias, 400 when the alias is not a replica.
     */
    @GetMapping("/replicas/{alias}")
    public ResponseEntity<ReplicaStatus> getReplicaStatus(@PathVariable String alias) {
        return ResponseEntity.ok(prober.probe(alias));
    }

    @GetMapping(value = "/litestream-config", produces = "application/yaml")
    public ResponseEntity<String> getLitestreamConfig() {
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType("application/yaml"))
            .body(configGenerator.render());
    }
}
