package com.example.litestream.config;

import com.example.litestream.util.VfsUris;

import java.util.Objects;

/**
 * Connection settings registered under one alias.
 */
public final class DatabaseSettings {

    private final String alias;
    private final Kind kind;
    private final String jdbcUrl;
    private final ReplicaEndpoint replica;

    private DatabaseSettings(String alias, Kind kind, String jdbcUrl, ReplicaEndpoint replica) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.replica = replica;
    }

    public static DatabaseSettings primary(String alias, String path) {
        return new DatabaseSettings(alias, Kind.PRIMARY, VfsUris.primaryUrl(path), null);
    }

    public static DatabaseSettings replica(ReplicaEndpoint endpoint) {
        return new DatabaseSettings(endpoint.alias(), Kind.REPLICA,
            VfsUris.replicaUrl(endpoint.alias(), endpoint.sourceUrl()), endpoint);
    }

    /**
     * Clone of these replica settings under another alias, served by a dedicated
     * time-travel connection. The clone reads the same replica file.
     */
    public DatabaseSettings timeTravelCopy(String tempAlias) {
        if (kind != Kind.REPLICA) {
            throw ReplicaConfigurationException.notReplica(alias);
        }
        return new DatabaseSettings(tempAlias, Kind.TIME_TRAVEL, jdbcUrl, replica);
    }

    public String alias() {
        return alias;
    }

    public Kind kind() {
        return kind;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * The replica this alias reads from, or {@code null} for the primary.
     */
    public ReplicaEndpoint replica() {
        return replica;
    }

    public boolean isReplica() {
        return kind == Kind.REPLICA;
    }

    /**
     * True for anything opened through the Litestream VFS.
     */
    public boolean usesVfs() {
        return kind != Kind.PRIMARY;
    }

    @Override
    public String toString() {
        return "DatabaseSettings{" + alias + ", " + kind + ", " + jdbcUrl + "}";
    }

    public enum Kind {
        PRIMARY,
        REPLICA,
        TIME_TRAVEL
    }
}
