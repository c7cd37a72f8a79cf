package com.example.litestream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the {@code litestream.*} configuration.
 * Bound once at startup; the rest of the application reads it through the getters only.
 */
@ConfigurationProperties(prefix = "litestream")
public class LitestreamProperties {

    public static final double DEFAULT_MAX_LAG_SECONDS = 60;

    private final Primary primary = new Primary();
    private final Pool pool = new Pool();
    private final Vfs vfs = new Vfs();
    private String pathPrefix;
    private final Map<String, Object> backupReplica = new LinkedHashMap<>();

    public Primary getPrimary() {
        return primary;
    }

    public Pool getPool() {
        return pool;
    }

    public Vfs getVfs() {
        return vfs;
    }

    /**
     * Optional prefix for the replica path of the generated Litestream config.
     */
    public String getPathPrefix() {
        return pathPrefix;
    }

    public void setPathPrefix(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    /**
     * Explicit litestream replica block for the primary, copied into the generated config
     * as is. When empty, an S3 replica driven by {@code $LITESTREAM_*} variables is used.
     */
    public Map<String, Object> getBackupReplica() {
        return backupReplica;
    }

    public static class Primary {

        private String alias = "default";
        private String path = "db.sqlite3";

        public String getAlias() {
            return alias;
        }

        public void setAlias(String alias) {
            this.alias = alias;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Pool {

        private int connectionTimeout = 5000;
        private int maximumPoolSize = 10;
        private int minimumIdle = 2;

        public int getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(int connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public int getMinimumIdle() {
            return minimumIdle;
        }

        public void setMinimumIdle(int minimumIdle) {
            this.minimumIdle = minimumIdle;
        }
    }

    public static class Vfs {

        private String extensionPath;
        private String downloadUrl;
        private double maxLagSeconds = DEFAULT_MAX_LAG_SECONDS;
        private final Map<String, Replica> replicas = new LinkedHashMap<>();

        /**
         * Filesystem location of the VFS extension. When unset, a platform default
         * under {@code ./bin} is used.
         */
        public String getExtensionPath() {
            return extensionPath;
        }

        public void setExtensionPath(String extensionPath) {
            this.extensionPath = extensionPath;
        }

        /**
         * Download location for the extension, with {@code {os}}, {@code {arch}} and
         * {@code {ext}} placeholders. When unset the extension must already be installed.
         */
        public String getDownloadUrl() {
            return downloadUrl;
        }

        public void setDownloadUrl(String downloadUrl) {
            this.downloadUrl = downloadUrl;
        }

        public double getMaxLagSeconds() {
            return maxLagSeconds;
        }

        public void setMaxLagSeconds(double maxLagSeconds) {
            this.maxLagSeconds = maxLagSeconds;
        }

        public Map<String, Replica> getReplicas() {
            return replicas;
        }
    }

    public static class Replica {

        private String url;
        private Double maxLagSeconds;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Double getMaxLagSeconds() {
            return maxLagSeconds;
        }

        public void setMaxLagSeconds(Double maxLagSeconds) {
            this.maxLagSeconds = maxLagSeconds;
        }
    }
}
