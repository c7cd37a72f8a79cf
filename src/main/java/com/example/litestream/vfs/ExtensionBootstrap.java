package com.example.litestream.vfs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Loads the VFS extension at startup when replicas are configured. A failure does not stop
 * the application: the first replica connection tries again and reports the error there.
 */
public class ExtensionBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ExtensionBootstrap.class);

    private final VfsExtensionLoader loader;
    private final boolean replicasConfigured;

    public ExtensionBootstrap(VfsExtensionLoader loader, boolean replicasConfigured) {
        this.loader = loader;
        this.replicasConfigured = replicasConfigured;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        preload();
    }

    /**
     * @return whether the extension is loaded afterwards
     */
    public boolean preload() {
        if (!replicasConfigured) {
            return false;
        }
        try {
            loader.ensureLoaded();
            return true;
        } catch (RuntimeException e) {
            log.warn("Litestream VFS extension not loaded at startup, will retry on first replica connection: {}",
                e.getMessage());
            return false;
        }
    }
}
