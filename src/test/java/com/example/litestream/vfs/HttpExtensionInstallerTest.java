package com.example.litestream.vfs;

import com.example.litestream.config.ReplicaConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpExtensionInstallerTest {

    @TempDir
    Path dir;

    @Test
    void unsupportedPlatformFailsOnlyWhenDownloading() {
        AtomicInteger resolved = new AtomicInteger();
        HttpExtensionInstaller installer = new HttpExtensionInstaller("https://host/vfs-{os}-{arch}.{ext}", () -> {
            resolved.incrementAndGet();
            return ExtensionPlatform.of("Linux", "ppc64le");
        }, HttpClient.newHttpClient());
        assertEquals(0, resolved.get());

        ReplicaConfigurationException error = assertThrows(ReplicaConfigurationException.class,
            () -> installer.install(dir.resolve("litestream-vfs.so")));
        assertEquals(ReplicaConfigurationException.Reason.EXTENSION_UNAVAILABLE, error.getReason());
        assertEquals(1, resolved.get());
        assertFalse(Files.exists(dir.resolve("litestream-vfs.so")));
    }

    @Test
    void missingUrlIsReportedBeforeResolvingThePlatform() {
        HttpExtensionInstaller installer = new HttpExtensionInstaller(" ",
            () -> fail("platform must not be resolved"), HttpClient.newHttpClient());

        ReplicaConfigurationException error = assertThrows(ReplicaConfigurationException.class,
            () -> installer.install(dir.resolve("litestream-vfs.so")));
        assertEquals(ReplicaConfigurationException.Reason.EXTENSION_UNAVAILABLE, error.getReason());
    }
}
