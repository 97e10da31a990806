package org.example.bookmarksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Snapshot of the sync configuration. A run reads one snapshot at start and passes it
 * down to every component call; changes only take effect on the next run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings(
    String apiKey,
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
    public SyncSettings {
        excludedTags = excludedTags == null ? List.of() : List.copyOf(excludedTags);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasTargetCollection() {
        return targetCollectionId != null && !targetCollectionId.isBlank();
    }

    public SyncSettings withLastSyncTimestamp(long timestamp) {
        return new SyncSettings(apiKey, apiEndpoint, targetCollectionId, syncIntervalMinutes, timestamp,
            updateExistingFiles, excludeArchived, onlyFavorites, excludedTags, downloadAssets);
    }
}
