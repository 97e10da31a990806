package org.example.bookmarksync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.bookmarksync.model.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Holds the current {@link SyncSettings} and persists them as JSON. Keys missing from the
 * file fall back to the configured defaults; unknown keys are ignored.
 */
@Component
public class SyncSettingsStore {

    private static final Logger log = LoggerFactory.getLogger(SyncSettingsStore.class);

    private final Path settingsFile;
    private final SyncSettings defaults;
    private final ObjectMapper objectMapper;

    private SyncSettings current;

    @Autowired
    public SyncSettingsStore(SyncProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getSettingsFile()), properties.toDefaultSettings(), objectMapper);
    }

    public SyncSettingsStore(Path settingsFile, SyncSettings defaults, ObjectMapper objectMapper) {
        this.settingsFile = settingsFile;
        this.defaults = defaults;
        this.objectMapper = objectMapper;
        this.current = load();
    }

    public synchronized SyncSettings current() {
        return current;
    }

    /**
     * Replaces the current settings and writes them to disk.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public synchronized void save(SyncSettings settings) {
        this.current = settings;
        persist();
    }

    /**
     * Stores the completion time of a sync run. The value always updates in memory but is
     * only written to disk when {@code persist} is set.
     */
    public synchronized void recordLastSync(long timestamp, boolean persist) {
        this.current = current.withLastSyncTimestamp(timestamp);
        if (persist) {
            persist();
        }
    }

    private SyncSettings load() {
        if (!Files.exists(settingsFile)) {
            log.info("No settings file at {}, using defaults", settingsFile);
            return defaults;
        }
        try {
            ObjectNode merged = objectMapper.valueToTree(defaults);
            JsonNode stored = objectMapper.readTree(settingsFile.toFile());
            if (stored != null && stored.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = stored.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (merged.has(field.getKey()) && !field.getValue().isNull()) {
                        merged.set(field.getKey(), field.getValue());
                    }
                }
            }
            SyncSettings loaded = objectMapper.treeToValue(merged, SyncSettings.class);
            log.info("Settings loaded from {}", settingsFile);
            return loaded;
        } catch (IOException e) {
            log.error("Failed to read settings file {}, using defaults", settingsFile, e);
            return defaults;
        }
    }

    private void persist() {
        try {
            Path parent = settingsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), current);
            log.info("Settings saved to {}", settingsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write settings file " + settingsFile, e);
        }
    }
}
