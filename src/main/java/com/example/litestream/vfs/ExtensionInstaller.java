package com.example.litestream.vfs;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Places the VFS extension binary at a filesystem location.
 */
@FunctionalInterface
public interface ExtensionInstaller {

    /**
     * Install the extension so that {@code target} exists and is loadable afterwards.
     */
    void install(Path target) throws IOException;
}
