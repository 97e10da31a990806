package org.example.bookmarksync.config;

import org.example.bookmarksync.model.SyncSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration. The {@code defaults} block seeds the runtime settings file the
 * first time the service starts; afterwards the file is authoritative.
 */
@Component
@ConfigurationProperties(prefix = "bookmark-sync")
public class SyncProperties {

    public static final String DEFAULT_API_ENDPOINT = "https://api.karakeep.app/api/v1";

    private String settingsFile = "./data/karakeep-sync-settings.json";
    private Defaults defaults = new Defaults();
    private Siyuan siyuan = new Siyuan();

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults == null ? new Defaults() : defaults;
    }

    public Siyuan getSiyuan() {
        return siyuan;
    }

    public void setSiyuan(Siyuan siyuan) {
        this.siyuan = siyuan == null ? new Siyuan() : siyuan;
    }

    public SyncSettings toDefaultSettings() {
        return new SyncSettings(
            defaults.getApiKey(),
            defaults.getApiEndpoint(),
            defaults.getTargetCollectionId(),
            defaults.getSyncIntervalMinutes(),
            0L,
            defaults.isUpdateExistingFiles(),
            defaults.isExcludeArchived(),
            defaults.isOnlyFavorites(),
            defaults.getExcludedTags(),
            defaults.isDownloadAssets()
        );
    }

    public static class Defaults {
        private String apiKey = "";
        private String apiEndpoint = DEFAULT_API_ENDPOINT;
        private String targetCollectionId;
        private int syncIntervalMinutes = 60;
        private boolean updateExistingFiles = false;
        private boolean excludeArchived = true;
        private boolean onlyFavorites = false;
        private List<String> excludedTags = new ArrayList<>();
        private boolean downloadAssets = true;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiEndpoint() {
            return apiEndpoint;
        }

        public void setApiEndpoint(String apiEndpoint) {
            this.apiEndpoint = apiEndpoint;
        }

        public String getTargetCollectionId() {
            return targetCollectionId;
        }

        public void setTargetCollectionId(String targetCollectionId) {
            this.targetCollectionId = targetCollectionId;
        }

        public int getSyncIntervalMinutes() {
            return syncIntervalMinutes;
        }

        public void setSyncIntervalMinutes(int syncIntervalMinutes) {
            this.syncIntervalMinutes = syncIntervalMinutes;
        }

        public boolean isUpdateExistingFiles() {
            return updateExistingFiles;
        }

        public void setUpdateExistingFiles(boolean updateExistingFiles) {
            this.updateExistingFiles = updateExistingFiles;
        }

        public boolean isExcludeArchived() {
            return excludeArchived;
        }

        public void setExcludeArchived(boolean excludeArchived) {
            this.excludeArchived = excludeArchived;
        }

        public boolean isOnlyFavorites() {
            return onlyFavorites;
        }

        public void setOnlyFavorites(boolean onlyFavorites) {
            this.onlyFavorites = onlyFavorites;
        }

        public List<String> getExcludedTags() {
            return excludedTags;
        }

        public void setExcludedTags(List<String> excludedTags) {
            this.excludedTags = excludedTags == null ? new ArrayList<>() : excludedTags;
        }

        public boolean isDownloadAssets() {
            return downloadAssets;
        }

        public void setDownloadAssets(boolean downloadAssets) {
            this.downloadAssets = downloadAssets;
        }
    }

    public static class Siyuan {
        private String baseUrl = "http://127.0.0.1:6806";
        private String apiToken;
        private String assetDirectory = "/assets/karakeep-sync/";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public String getAssetDirectory() {
            return assetDirectory;
        }

        public void setAssetDirectory(String assetDirectory) {
            this.assetDirectory = assetDirectory;
        }
    }
}
