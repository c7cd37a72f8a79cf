package com.example.litestream.config;

import com.example.litestream.vfs.VfsExtensionLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ReplicaDataSourceConfigTest {

    private final ReplicaDataSourceConfig config = new ReplicaDataSourceConfig();
    private String originalArch;

    @BeforeEach
    void pretendUnsupportedArchitecture() {
        originalArch = System.getProperty("os.arch");
        System.setProperty("os.arch", "ppc64le");
    }

    @AfterEach
    void restoreArchitecture() {
        System.setProperty("os.arch", originalArch);
    }

    @Test
    void primaryOnlyConfigurationStartsOnUnsupportedPlatform() {
        LitestreamProperties properties = new LitestreamProperties();
        properties.getVfs().setExtensionPath("/opt/custom/litestream-vfs.so");

        VfsExtensionLoader loader = config.vfsExtensionLoader(properties);
        DatabaseRegistry registry = config.databaseRegistry(properties,
            config.dataSourceFactory(properties, loader));

        assertEquals(Path.of("/opt/custom/litestream-vfs.so"), loader.getExtensionPath());
        assertFalse(loader.isLoaded());
        assertEquals(List.of("default"), registry.aliases());
        assertFalse(config.extensionBootstrap(loader, registry).preload());
    }

    @Test
    void defaultExtensionPathDoesNotNeedASupportedArchitecture() {
        VfsExtensionLoader loader = config.vfsExtensionLoader(new LitestreamProperties());

        assertEquals(Path.of("bin").toString(), loader.getExtensionPath().getParent().toString());
        assertTrue(loader.getExtensionPath().getFileName().toString().startsWith("litestream-vfs."));
    }

    @Test
    void replicasAreRegisteredWithoutOpeningThem() {
        LitestreamProperties properties = new LitestreamProperties();
        LitestreamProperties.Replica replica = new LitestreamProperties.Replica();
        replica.setUrl("s3://bucket/db.sqlite3");
        properties.getVfs().getReplicas().put("r1", replica);

        DataSourceFactory factory = mock(DataSourceFactory.class);
        DatabaseRegistry registry = config.databaseRegistry(properties, factory);

        assertEquals(List.of("r1"), registry.replicaAliases());
        assertFalse(registry.isOpen("r1"));
    }
}
