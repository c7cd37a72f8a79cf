package com.example.litestream.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the SQLite JDBC URLs for primary and VFS replica databases.
 */
public final class VfsUris {

    public static final String VFS_NAME = "litestream";
    public static final String REPLICA_URL_PARAMETER = "litestream_replica_url";

    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    private VfsUris() {
    }

    /**
     * URL of a plain on-disk SQLite database.
     */
    public static String primaryUrl(String path) {
        return JDBC_PREFIX + path;
    }

    /**
     * URL of a read-only replica served by the Litestream VFS. The source url travels as a
     * URI parameter so each replica file carries its own.
     */
    public static String replicaUrl(String alias, String sourceUrl) {
        return JDBC_PREFIX + "file:" + alias + ".db?vfs=" + VFS_NAME + "&mode=ro&"
            + REPLICA_URL_PARAMETER + "=" + URLEncoder.encode(sourceUrl, StandardCharsets.UTF_8);
    }

    /**
     * URL of a throwaway in-memory database, used to register extensions.
     */
    public static String inMemoryUrl() {
        return JDBC_PREFIX + ":memory:";
    }
}
