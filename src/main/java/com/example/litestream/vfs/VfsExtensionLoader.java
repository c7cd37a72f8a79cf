package com.example.litestream.vfs;

import com.example.litestream.config.ReplicaConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Makes sure the Litestream VFS extension is registered with SQLite before any replica
 * connection is opened.
 *
 * <p>The extension registers a VFS globally in the native SQLite library, so loading it
 * once is enough for the whole process. The application keeps a single instance for its
 * lifetime; there is no way to unload it. {@link #ensureLoaded()} uses double-checked
 * locking: once loaded, callers only read a volatile flag.
 *
 * <p>A failed attempt leaves the loader unloaded, so the next call installs and loads
 * from scratch.
 */
public class VfsExtensionLoader {

    private static final Logger log = LoggerFactory.getLogger(VfsExtensionLoader.class);

    private final Path extensionPath;
    private final ExtensionInstaller installer;
    private final ExtensionRegistrar registrar;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean loaded;

    public VfsExtensionLoader(Path extensionPath, ExtensionInstaller installer, ExtensionRegistrar registrar) {
        this.extensionPath = extensionPath;
        this.installer = installer;
        this.registrar = registrar;
    }

    /**
     * Load the extension if this process has not done so yet. Safe to call from any
     * number of threads.
     *
     * @throws ExtensionLoadException if installing or loading fails
     * @throws ReplicaConfigurationException if no extension exists for this platform
     */
    public void ensureLoaded() {
        if (loaded) {
            return;
        }
        lock.lock();
        try {
            if (loaded) {
                return;
            }
            if (!Files.exists(extensionPath)) {
                log.info("Litestream VFS extension missing at {}, installing", extensionPath);
                try {
                    installer.install(extensionPath);
                } catch (IOException e) {
                    throw new ExtensionLoadException(
                        "Failed to install Litestream VFS extension to " + extensionPath + ". Error: " + e.getMessage(), e);
                }
                if (!Files.exists(extensionPath)) {
                    throw new ExtensionLoadException(
                        "Installer finished but " + extensionPath + " does not exist", null);
                }
            }
            try {
                registrar.register(extensionPath);
            } catch (SQLException | RuntimeException e) {
                throw new ExtensionLoadException(
                    "Failed to load Litestream VFS extension from " + extensionPath + ". Error: " + e.getMessage(), e);
            }
            loaded = true;
            log.info("Litestream VFS extension loaded from {}", extensionPath);
        } finally {
            lock.unlock();
        }
    }

    public boolean isLoaded() {
        return loaded;
    }

    public Path getExtensionPath() {
        return extensionPath;
    }
}
