package com.example.litestream.vfs;

/**
 * The VFS extension could not be installed or loaded. Nothing is recorded, so the next
 * attempt starts over.
 */
public class ExtensionLoadException extends RuntimeException {

    public ExtensionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
