package com.example.litestream.vfs;

import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Loads a native extension into the SQLite library of this process.
 */
@FunctionalInterface
public interface ExtensionRegistrar {

    void register(Path extension) throws SQLException;
}
