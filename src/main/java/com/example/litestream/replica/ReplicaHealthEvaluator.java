package com.example.litestream.replica;

import com.example.litestream.config.DatabaseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which replicas are fresh enough to serve reads.
 *
 * <p>Every call probes every replica again; lag moves continuously, so results are never
 * cached. A replica is healthy only when it reports a lag at or below its own threshold.
 */
public class ReplicaHealthEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReplicaHealthEvaluator.class);

    private final ReplicaStatusProber prober;
    private final DatabaseRegistry registry;

    public ReplicaHealthEvaluator(ReplicaStatusProber prober, DatabaseRegistry registry) {
        this.prober = prober;
        this.registry = registry;
    }

    /**
     * The healthy subset of {@code aliases}, in the given order. Failures while checking
     * one replica exclude only that replica.
     */
    public List<String> healthyReplicas(List<String> aliases) {
        List<String> healthy = new ArrayList<>();
        for (String alias : aliases) {
            try {
                if (isHealthy(alias)) {
                    healthy.add(alias);
                }
            } catch (RuntimeException e) {
                log.debug("Excluding replica {}: {}", alias, e.getMessage());
            }
        }
        return healthy;
    }

    /**
     * Probe one replica against its configured threshold.
     */
    public boolean isHealthy(String alias) {
        double maxLag = registry.replicaSettings(alias).replica().maxLagSeconds();
        ReplicaStatus status = prober.probe(alias);
        boolean healthy = status.isWithin(maxLag);
        if (!healthy) {
            log.debug("Replica {} unhealthy: {} (max lag {}s)", alias, status, maxLag);
        }
        return healthy;
    }
}
