package com.example.litestream.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A configured Litestream VFS replica: where it replicates from and how stale it may get
 * before reads stop being routed to it.
 */
public final class ReplicaEndpoint {

    private final String alias;
    private final String sourceUrl;
    private final double maxLagSeconds;

    public ReplicaEndpoint(String alias, String sourceUrl, double maxLagSeconds) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Replica alias must not be blank");
        }
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("Replica '" + alias + "' has no source url");
        }
        if (!(maxLagSeconds > 0)) {
            throw new IllegalArgumentException(
                "Replica '" + alias + "' max lag must be positive, got " + maxLagSeconds);
        }
        this.alias = alias;
        this.sourceUrl = sourceUrl;
        this.maxLagSeconds = maxLagSeconds;
    }

    public ReplicaEndpoint(String alias, String sourceUrl) {
        this(alias, sourceUrl, LitestreamProperties.DEFAULT_MAX_LAG_SECONDS);
    }

    /**
     * Build one endpoint per configured replica, in configuration order. Replicas without
     * their own threshold inherit the global one.
     */
    public static List<ReplicaEndpoint> fromProperties(LitestreamProperties.Vfs vfs) {
        List<ReplicaEndpoint> endpoints = new ArrayList<>();
        for (Map.Entry<String, LitestreamProperties.Replica> entry : vfs.getReplicas().entrySet()) {
            LitestreamProperties.Replica replica = entry.getValue();
            double maxLag = replica.getMaxLagSeconds() != null
                ? replica.getMaxLagSeconds()
                : vfs.getMaxLagSeconds();
            endpoints.add(new ReplicaEndpoint(entry.getKey(), replica.getUrl(), maxLag));
        }
        return Collections.unmodifiableList(endpoints);
    }

    public String alias() {
        return alias;
    }

    public String sourceUrl() {
        return sourceUrl;
    }

    public double maxLagSeconds() {
        return maxLagSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReplicaEndpoint)) return false;
        ReplicaEndpoint that = (ReplicaEndpoint) o;
        return Double.compare(that.maxLagSeconds, maxLagSeconds) == 0
            && alias.equals(that.alias)
            && sourceUrl.equals(that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, sourceUrl, maxLagSeconds);
    }

    @Override
    public String toString() {
        return "ReplicaEndpoint{" + alias + " <- " + sourceUrl + ", maxLag=" + maxLagSeconds + "s}";
    }
}
