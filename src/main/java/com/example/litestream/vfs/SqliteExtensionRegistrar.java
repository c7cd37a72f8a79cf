package com.example.litestream.vfs;

import com.example.litestream.util.VfsUris;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Registers an extension by loading it into a throwaway in-memory connection. A VFS
 * registers itself globally with the SQLite library, so every later connection of this
 * process can open files with it.
 */
public class SqliteExtensionRegistrar implements ExtensionRegistrar {

    @Override
    public void register(Path extension) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.enableLoadExtension(true);
        try (Connection conn = config.createConnection(VfsUris.inMemoryUrl());
             PreparedStatement stmt = conn.prepareStatement("SELECT load_extension(?)")) {
            stmt.setString(1, extension.toAbsolutePath().toString());
            stmt.execute();
        }
    }
}
