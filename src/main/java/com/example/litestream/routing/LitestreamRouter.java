package com.example.litestream.routing;

import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.replica.ReplicaHealthEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Sends reads to a random replica that is within its lag threshold and everything else to
 * the primary.
 *
 * <p>The replica aliases are discovered from the registry on first use and cached for the
 * life of the router; replicas registered later are not seen. Health is evaluated on every
 * read. Any failure while doing so routes the read to the primary.
 *
 * <p>Reads are not guaranteed to observe a preceding write: only the primary is current.
 */
public class LitestreamRouter implements DatabaseRouter {

    private static final Logger log = LoggerFactory.getLogger(LitestreamRouter.class);

    private final DatabaseRegistry registry;
    private final ReplicaHealthEvaluator healthEvaluator;
    private final String primaryAlias;
    private final Random random;

    private final Object aliasLock = new Object();
    private volatile List<String> replicaAliases;

    public LitestreamRouter(DatabaseRegistry registry, ReplicaHealthEvaluator healthEvaluator,
                            String primaryAlias) {
        this(registry, healthEvaluator, primaryAlias, new Random());
    }

    public LitestreamRouter(DatabaseRegistry registry, ReplicaHealthEvaluator healthEvaluator,
                            String primaryAlias, Random random) {
        this.registry = registry;
        this.healthEvaluator = healthEvaluator;
        this.primaryAlias = primaryAlias;
        this.random = random;
    }

    @Override
    public String dbForRead() {
        List<String> healthy = healthyReplicas();
        if (healthy.isEmpty()) {
            log.debug("No healthy replica, routing read to {}", primaryAlias);
            return primaryAlias;
        }
        String chosen = healthy.get(random.nextInt(healthy.size()));
        log.debug("Routing read to replica {} ({} healthy)", chosen, healthy.size());
        return chosen;
    }

    @Override
    public String dbForWrite() {
        return primaryAlias;
    }

    @Override
    public Boolean allowRelation(String firstAlias, String secondAlias) {
        return Boolean.TRUE;
    }

    @Override
    public Boolean allowMigrate(String alias) {
        if (primaryAlias.equals(alias)) {
            return Boolean.TRUE;
        }
        if (replicaAliases().contains(alias)) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Replicas currently within their lag threshold; empty when evaluation fails.
     */
    public List<String> healthyReplicas() {
        try {
            return healthEvaluator.healthyReplicas(replicaAliases());
        } catch (RuntimeException e) {
            log.warn("Replica health evaluation failed, using primary: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Replica aliases known to this router, discovered once.
     */
    public List<String> replicaAliases() {
        List<String> aliases = replicaAliases;
        if (aliases == null) {
            synchronized (aliasLock) {
                aliases = replicaAliases;
                if (aliases == null) {
                    aliases = Collections.unmodifiableList(registry.replicaAliases());
                    replicaAliases = aliases;
                    log.info("Discovered VFS replicas: {}", aliases);
                }
            }
        }
        return aliases;
    }

    public String getPrimaryAlias() {
        return primaryAlias;
    }
}
