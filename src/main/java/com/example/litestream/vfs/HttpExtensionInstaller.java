package com.example.litestream.vfs;

import com.example.litestream.config.ReplicaConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Downloads the extension for the current platform from a url template. The platform is
 * only resolved when a download is actually needed.
 */
public class HttpExtensionInstaller implements ExtensionInstaller {

    private static final Logger log = LoggerFactory.getLogger(HttpExtensionInstaller.class);

    private final String urlTemplate;
    private final Supplier<ExtensionPlatform> platform;
    private final HttpClient client;

    public HttpExtensionInstaller(String urlTemplate) {
        this(urlTemplate, ExtensionPlatform::current, HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    HttpExtensionInstaller(String urlTemplate, Supplier<ExtensionPlatform> platform, HttpClient client) {
        this.urlTemplate = urlTemplate;
        this.platform = platform;
        this.client = client;
    }

    @Override
    public void install(Path target) throws IOException {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new ReplicaConfigurationException(ReplicaConfigurationException.Reason.EXTENSION_UNAVAILABLE,
                "Litestream VFS extension not found at " + target
                    + " and no download url is configured");
        }
        ExtensionPlatform current = platform.get();
        URI uri = URI.create(current.expand(urlTemplate));
        log.info("Downloading Litestream VFS extension for {} from {}", current, uri);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        HttpRequest request = HttpRequest.newBuilder(uri).GET().build();
        try {
            HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(partial));
            if (response.statusCode() != 200) {
                throw new IOException("Download of " + uri + " failed with HTTP " + response.statusCode());
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading " + uri, e);
        } finally {
            Files.deleteIfExists(partial);
        }
        log.info("Installed Litestream VFS extension at {}", target);
    }
}
