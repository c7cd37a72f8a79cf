package com.example.litestream.replica;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One probe of a VFS replica. Fields the replica could not report are unknown rather
 * than defaulted.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class ReplicaStatus {

    private final String alias;
    private final String sourceUrl;
    private final String txid;
    private final Double lagSeconds;
    private final Instant probedAt;

    public ReplicaStatus(String alias, String sourceUrl, String txid, Double lagSeconds, Instant probedAt) {
        this.alias = alias;
        this.sourceUrl = sourceUrl;
        this.txid = txid;
        this.lagSeconds = lagSeconds;
        this.probedAt = probedAt;
    }

    @JsonProperty("alias")
    public String alias() {
        return alias;
    }

    @JsonProperty("is_replica")
    public boolean isReplica() {
        return true;
    }

    @JsonProperty("source_url")
    public String sourceUrl() {
        return sourceUrl;
    }

    public Optional<String> txid() {
        return Optional.ofNullable(txid);
    }

    public OptionalDouble lagSeconds() {
        return lagSeconds == null ? OptionalDouble.empty() : OptionalDouble.of(lagSeconds);
    }

    @JsonProperty("probed_at")
    public Instant probedAt() {
        return probedAt;
    }

    @JsonProperty("txid")
    String txidOrNull() {
        return txid;
    }

    @JsonProperty("lag_seconds")
    Double lagSecondsOrNull() {
        return lagSeconds;
    }

    /**
     * True iff the lag is known and at most {@code maxLagSeconds}.
     */
    public boolean isWithin(double maxLagSeconds) {
        return lagSeconds != null && lagSeconds <= maxLagSeconds;
    }

    @Override
    public String toString() {
        return "ReplicaStatus{" + alias
            + ", txid=" + (txid == null ? "unknown" : txid)
            + ", lag=" + (lagSeconds == null ? "unknown" : lagSeconds + "s") + "}";
    }
}
