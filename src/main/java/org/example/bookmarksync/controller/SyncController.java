package org.example.bookmarksync.controller;

import org.example.bookmarksync.config.SyncSettingsStore;
import org.example.bookmarksync.karakeep.KarakeepUrls;
import org.example.bookmarksync.model.SyncResult;
import org.example.bookmarksync.model.SyncSettings;
import org.example.bookmarksync.model.SyncState;
import org.example.bookmarksync.model.TargetCollection;
import org.example.bookmarksync.service.BookmarkSyncService;
import org.example.bookmarksync.service.PeriodicSyncScheduler;
import org.example.bookmarksync.store.TargetStore;
import org.example.bookmarksync.store.TargetStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final BookmarkSyncService syncService;
    private final SyncSettingsStore settingsStore;
    private final PeriodicSyncScheduler periodicSyncScheduler;
    private final TargetStore targetStore;

    public SyncController(BookmarkSyncService syncService,
                          SyncSettingsStore settingsStore,
                          PeriodicSyncScheduler periodicSyncScheduler,
                          TargetStore targetStore) {
        this.syncService = syncService;
        this.settingsStore = settingsStore;
        this.periodicSyncScheduler = periodicSyncScheduler;
        this.targetStore = targetStore;
    }

    public record StatusResponse(
        SyncState state,
        boolean running,
        long lastSyncTimestamp,
        SyncResult lastResult
    ) {}

    public record SettingsView(
        boolean apiKeyConfigured,
        String apiEndpoint,
        String targetCollectionId,
        int syncIntervalMinutes,
        long lastSyncTimestamp,
        boolean updateExistingFiles,
        boolean excludeArchived,
        boolean onlyFavorites,
        List<String> excludedTags,
        boolean downloadAssets
    ) {
        static SettingsView from(SyncSettings settings) {
            return new SettingsView(
                settings.hasApiKey(),
                settings.apiEndpoint(),
                settings.targetCollectionId(),
                settings.syncIntervalMinutes(),
                settings.lastSyncTimestamp(),
                settings.updateExistingFiles(),
                settings.excludeArchived(),
                settings.onlyFavorites(),
                settings.excludedTags(),
                settings.downloadAssets()
            );
        }
    }

    /**
     * A blank {@code apiKey} or {@code apiEndpoint} keeps the stored value; any other field
     * left out of the body keeps its stored value too.
     */
    public record SettingsUpdateRequest(
        String apiKey,
        String apiEndpoint,
        String targetCollectionId,
        Integer syncIntervalMinutes,
        Boolean updateExistingFiles,
        Boolean excludeArchived,
        Boolean onlyFavorites,
        List<String> excludedTags,
        Boolean downloadAssets
    ) {}

    @PostMapping
    public ResponseEntity<SyncResult> runSync() {
        SyncResult result = syncService.runSync();
        return switch (result.outcome()) {
            case ALREADY_RUNNING -> ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            case CONFIGURATION_ERROR -> ResponseEntity.badRequest().body(result);
            default -> ResponseEntity.ok(result);
        };
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return new StatusResponse(
            syncService.getState(),
            syncService.isRunning(),
            settingsStore.current().lastSyncTimestamp(),
            syncService.getLastResult().orElse(null)
        );
    }

    @GetMapping("/settings")
    public SettingsView getSettings() {
        return SettingsView.from(settingsStore.current());
    }

    @PutMapping("/settings")
    public ResponseEntity<?> updateSettings(@RequestBody SettingsUpdateRequest request) {
        SyncSettings current = settingsStore.current();
        String apiKey = request.apiKey() == null || request.apiKey().isBlank() ? current.apiKey() : request.apiKey().trim();
        SyncSettings updated = new SyncSettings(
            apiKey,
            request.apiEndpoint() == null || request.apiEndpoint().isBlank() ? current.apiEndpoint() : request.apiEndpoint().trim(),
            request.targetCollectionId() == null ? current.targetCollectionId() : request.targetCollectionId(),
            orCurrent(request.syncIntervalMinutes(), current.syncIntervalMinutes()),
            current.lastSyncTimestamp(),
            orCurrent(request.updateExistingFiles(), current.updateExistingFiles()),
            orCurrent(request.excludeArchived(), current.excludeArchived()),
            orCurrent(request.onlyFavorites(), current.onlyFavorites()),
            request.excludedTags() == null ? current.excludedTags() : request.excludedTags().stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .toList(),
            orCurrent(request.downloadAssets(), current.downloadAssets())
        );

        if (!updated.hasApiKey()) {
            return ResponseEntity.badRequest().body(Map.of("message", "Karakeep API key is required."));
        }
        if (!isHttpEndpoint(updated.apiEndpoint())) {
            return ResponseEntity.badRequest()
                .body(Map.of("message", "A valid Karakeep API Endpoint (starting with http/https) is required."));
        }
        if (!updated.hasTargetCollection()) {
            return ResponseEntity.badRequest().body(Map.of("message", "Please select a target SiYuan notebook."));
        }
        if (updated.syncIntervalMinutes() < 0) {
            return ResponseEntity.badRequest().body(Map.of("message", "Sync interval must be zero or positive."));
        }

        settingsStore.save(updated);
        periodicSyncScheduler.restart();
        return ResponseEntity.ok(SettingsView.from(updated));
    }

    @GetMapping("/collections")
    public ResponseEntity<List<TargetCollection>> listCollections() {
        try {
            return ResponseEntity.ok(targetStore.listCollections());
        } catch (TargetStoreException e) {
            log.error("Could not list target notebooks", e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
        }
    }

    private static boolean isHttpEndpoint(String apiEndpoint) {
        return KarakeepUrls.origin(apiEndpoint)
            .filter(origin -> origin.startsWith("http://") || origin.startsWith("https://"))
            .isPresent();
    }

    private static <T> T orCurrent(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
