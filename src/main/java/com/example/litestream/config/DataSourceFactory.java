package com.example.litestream.config;

import com.example.litestream.vfs.VfsExtensionLoader;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Creates the {@link DataSource} behind each registered alias.
 * Primary and replicas get a HikariCP pool; time-travel aliases get one dedicated
 * connection, because the point-in-time pragma only applies to the connection it ran on.
 */
public class DataSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

    static final String DRIVER_CLASS = "org.sqlite.JDBC";

    private final LitestreamProperties.Pool pool;
    private final VfsExtensionLoader extensionLoader;

    public DataSourceFactory(LitestreamProperties.Pool pool, VfsExtensionLoader extensionLoader) {
        this.pool = pool;
        this.extensionLoader = extensionLoader;
    }

    public DataSource create(DatabaseSettings settings) {
        if (settings.usesVfs()) {
            extensionLoader.ensureLoaded();
        }
        switch (settings.kind()) {
            case TIME_TRAVEL:
                return createSingleConnectionDataSource(settings);
            case REPLICA:
                return createPooledDataSource(settings, true);
            default:
                return createPooledDataSource(settings, false);
        }
    }

    private DataSource createPooledDataSource(DatabaseSettings settings, boolean readOnly) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("litestream-" + settings.alias());
        config.setDriverClassName(DRIVER_CLASS);
        config.setJdbcUrl(settings.jdbcUrl());

        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(Math.min(pool.getMinimumIdle(), pool.getMaximumPoolSize()));
        config.setConnectionTimeout(pool.getConnectionTimeout());
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setConnectionTestQuery("SELECT 1");
        config.setAutoCommit(true);
        // replicas may be unreachable at boot; the router treats that as unhealthy
        config.setInitializationFailTimeout(readOnly ? -1 : 1);
        config.setDataSourceProperties(sqliteProperties(readOnly));

        log.debug("Creating pooled datasource {} -> {}", settings.alias(), settings.jdbcUrl());
        return new HikariDataSource(config);
    }

    private DataSource createSingleConnectionDataSource(DatabaseSettings settings) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setDriverClassName(DRIVER_CLASS);
        dataSource.setUrl(settings.jdbcUrl());
        dataSource.setSuppressClose(true);
        dataSource.setConnectionProperties(sqliteProperties(true));
        log.debug("Creating dedicated datasource {} -> {}", settings.alias(), settings.jdbcUrl());
        return dataSource;
    }

    private static Properties sqliteProperties(boolean readOnly) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.OPEN_URI);
        config.setReadOnly(readOnly);
        return config.toProperties();
    }

    /**
     * Release everything held by a datasource created here.
     */
    public void close(DataSource dataSource) {
        if (dataSource instanceof DisposableBean) {
            try {
                ((DisposableBean) dataSource).destroy();
            } catch (Exception e) {
                log.warn("Failed to close datasource: {}", e.getMessage());
            }
        } else if (dataSource instanceof HikariDataSource) {
            ((HikariDataSource) dataSource).close();
        }
    }

    /**
     * Check whether a connection can be obtained and is valid.
     */
    public boolean isDataSourceAvailable(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            return false;
        }
    }
}
