package com.example.litestream.config;

import com.example.litestream.vfs.ExtensionLoadException;
import com.example.litestream.vfs.VfsExtensionLoader;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DataSourceFactoryTest {

    @TempDir
    Path dir;

    private VfsExtensionLoader loader;
    private DataSourceFactory factory;

    @BeforeEach
    void setUp() {
        loader = mock(VfsExtensionLoader.class);
        LitestreamProperties.Pool pool = new LitestreamProperties.Pool();
        pool.setMaximumPoolSize(2);
        pool.setMinimumIdle(1);
        factory = new DataSourceFactory(pool, loader);
    }

    @Test
    void primaryIsPooledWithoutTheExtension() {
        DataSource dataSource = factory.create(
            DatabaseSettings.primary("default", dir.resolve("db.sqlite3").toString()));
        try {
            assertTrue(dataSource instanceof HikariDataSource);
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);
            jdbc.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT)");
            jdbc.update("INSERT INTO users (name) VALUES (?)", "ada");
            assertEquals(1, jdbc.queryForObject("SELECT COUNT(*) FROM users", Integer.class));
            assertTrue(factory.isDataSourceAvailable(dataSource));
        } finally {
            factory.close(dataSource);
        }
        assertTrue(((HikariDataSource) dataSource).isClosed());
        verify(loader, never()).ensureLoaded();
    }

    @Test
    void replicaRequiresTheExtension() {
        doThrow(new ExtensionLoadException("no extension", null)).when(loader).ensureLoaded();

        assertThrows(ExtensionLoadException.class,
            () -> factory.create(DatabaseSettings.replica(new ReplicaEndpoint("r1", "s3://a/db"))));
    }

    @Test
    void timeTravelGetsOneDedicatedConnection() {
        DatabaseSettings replica = DatabaseSettings.replica(new ReplicaEndpoint("r1", "s3://a/db"));

        DataSource dataSource = factory.create(replica.timeTravelCopy("_tt_r1"));

        verify(loader).ensureLoaded();
        assertTrue(dataSource instanceof SingleConnectionDataSource);
        factory.close(dataSource);
    }
}
