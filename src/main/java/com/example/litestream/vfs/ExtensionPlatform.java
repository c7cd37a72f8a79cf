package com.example.litestream.vfs;

import com.example.litestream.config.ReplicaConfigurationException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Operating system and architecture the VFS extension binary is built for.
 */
public final class ExtensionPlatform {

    private final String os;
    private final String arch;

    ExtensionPlatform(String os, String arch) {
        this.os = os;
        this.arch = arch;
    }

    public static ExtensionPlatform current() {
        return of(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    /**
     * Map JVM os/arch names onto the names used by Litestream release artifacts.
     */
    public static ExtensionPlatform of(String osName, String osArch) {
        String name = osName.toLowerCase(Locale.ROOT);
        String os;
        if (name.contains("linux")) {
            os = "linux";
        } else if (name.contains("mac") || name.contains("darwin")) {
            os = "darwin";
        } else if (name.contains("windows")) {
            os = "windows";
        } else {
            throw unsupported(osName, osArch);
        }

        String arch;
        switch (osArch.toLowerCase(Locale.ROOT)) {
            case "amd64":
            case "x86_64":
                arch = "amd64";
                break;
            case "aarch64":
            case "arm64":
                arch = "arm64";
                break;
            default:
                throw unsupported(osName, osArch);
        }
        return new ExtensionPlatform(os, arch);
    }

    public String os() {
        return os;
    }

    public String arch() {
        return arch;
    }

    /**
     * Shared library suffix, without the dot.
     */
    public String libraryExtension() {
        return libraryExtension(os);
    }

    public Path defaultExtensionPath() {
        return defaultExtensionPath(os);
    }

    /**
     * Default location of the extension for a JVM {@code os.name}. Works for any operating
     * system, including ones no extension is published for.
     */
    public static Path defaultExtensionPath(String osName) {
        return Path.of("bin", "litestream-vfs." + libraryExtension(osName));
    }

    private static String libraryExtension(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.contains("mac") || name.contains("darwin")) {
            return "dylib";
        }
        if (name.contains("windows")) {
            return "dll";
        }
        return "so";
    }

    /**
     * Fill the {@code {os}}, {@code {arch}} and {@code {ext}} placeholders of a template.
     */
    public String expand(String template) {
        return template.replace("{os}", os).replace("{arch}", arch).replace("{ext}", libraryExtension());
    }

    private static ReplicaConfigurationException unsupported(String osName, String osArch) {
        return new ReplicaConfigurationException(ReplicaConfigurationException.Reason.EXTENSION_UNAVAILABLE,
            "The Litestream VFS extension is not available for " + osName + "/" + osArch);
    }

    @Override
    public String toString() {
        return os + "-" + arch;
    }
}
