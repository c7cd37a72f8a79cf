package com.example.litestream.config;

/**
 * Raised when an alias is missing, is not a VFS replica, or the replica machinery cannot be
 * set up for this platform. Never retried automatically.
 */
public class ReplicaConfigurationException extends RuntimeException {

    private final Reason reason;

    public ReplicaConfigurationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ReplicaConfigurationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ReplicaConfigurationException notFound(String alias) {
        return new ReplicaConfigurationException(Reason.ALIAS_NOT_FOUND,
            "Database '" + alias + "' not found in the configured databases");
    }

    public static ReplicaConfigurationException notReplica(String alias) {
        return new ReplicaConfigurationException(Reason.NOT_A_REPLICA,
            "Database '" + alias + "' is not a VFS database. "
                + "Status checks and time-travel only work with VFS replicas.");
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        ALIAS_NOT_FOUND,
        ALIAS_IN_USE,
        NOT_A_REPLICA,
        EXTENSION_UNAVAILABLE
    }
}
