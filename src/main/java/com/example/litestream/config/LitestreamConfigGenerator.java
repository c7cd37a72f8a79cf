package com.example.litestream.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the {@code litestream.yml} the external {@code litestream replicate} process needs
 * to ship the primary database. Credentials and bucket stay as {@code $LITESTREAM_*}
 * placeholders, expanded by litestream from its environment.
 */
public class LitestreamConfigGenerator {

    static final String ACCESS_KEY_PLACEHOLDER = "$LITESTREAM_ACCESS_KEY_ID";
    static final String SECRET_KEY_PLACEHOLDER = "$LITESTREAM_SECRET_ACCESS_KEY";
    static final String BUCKET_PLACEHOLDER = "$LITESTREAM_REPLICA_BUCKET";

    private final LitestreamProperties properties;
    private final ObjectMapper yamlMapper;

    public LitestreamConfigGenerator(LitestreamProperties properties) {
        this.properties = properties;
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    }

    public Map<String, Object> generate() {
        String dbPath = properties.getPrimary().getPath();
        Map<String, Object> db = new LinkedHashMap<>();
        db.put("path", dbPath);

        Map<String, Object> config = new LinkedHashMap<>();
        if (!properties.getBackupReplica().isEmpty()) {
            db.put("replica", new LinkedHashMap<>(properties.getBackupReplica()));
            config.put("dbs", List.of(db));
            return config;
        }

        String backupPath = Path.of(dbPath).getFileName().toString();
        String prefix = properties.getPathPrefix();
        if (prefix != null && !prefix.isBlank()) {
            backupPath = stripTrailingSlashes(prefix) + "/" + backupPath;
        }

        Map<String, Object> replica = new LinkedHashMap<>();
        replica.put("type", "s3");
        replica.put("bucket", BUCKET_PLACEHOLDER);
        replica.put("path", backupPath);

        db.put("replica", replica);

        // credentials only accompany the generated S3 replica
        config.put("access-key-id", ACCESS_KEY_PLACEHOLDER);
        config.put("secret-access-key", SECRET_KEY_PLACEHOLDER);
        config.put("dbs", List.of(db));
        return config;
    }

    public String render() {
        try {
            return yamlMapper.writeValueAsString(generate());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render Litestream config", e);
        }
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
