package org.example.bookmarksync.service;

import org.example.bookmarksync.config.SyncProperties;
import org.example.bookmarksync.karakeep.KarakeepUrls;
import org.example.bookmarksync.model.SyncSettings;
import org.example.bookmarksync.store.TargetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads a bookmark asset (image, screenshot, pdf) and re-uploads it into the target
 * store so documents do not depend on the source staying reachable.
 */
@Service
public class AssetRehostService {

    private static final Logger log = LoggerFactory.getLogger(AssetRehostService.class);

    private static final int MAX_URL_FILENAME_LENGTH = 50;
    private static final int MAX_TITLE_PART_LENGTH = 20;
    private static final String FALLBACK_CONTENT_TYPE = "application/octet-stream";

    private static final Map<String, String> EXTENSIONS_BY_CONTENT_TYPE = Map.of(
        "image/jpeg", "jpg",
        "image/png", "png",
        "image/gif", "gif",
        "image/webp", "webp",
        "image/svg+xml", "svg",
        "application/pdf", "pdf"
    );

    private final RestClient restClient;
    private final TargetStore targetStore;
    private final String assetDirectory;

    public AssetRehostService(RestClient.Builder restClientBuilder,
                              TargetStore targetStore,
                              SyncProperties properties) {
        this.restClient = restClientBuilder.build();
        this.targetStore = targetStore;
        this.assetDirectory = properties.getSiyuan().getAssetDirectory();
    }

    /**
     * Fetches {@code assetUrl} and uploads it to the configured collection.
     *
     * @param idHint    id used to name the file when the URL carries no usable filename
     * @param titleHint bookmark title, also used for synthesized filenames
     * @return the store-relative asset reference, or empty when download or upload failed
     */
    public Optional<String> fetchAndRehost(SyncSettings settings, String assetUrl, String idHint, String titleHint) {
        log.info("Downloading asset for re-hosting: {}", assetUrl);
        try {
            return download(settings, assetUrl)
                .flatMap(asset -> {
                    String fileName = resolveFileName(assetUrl, asset.contentType(), idHint, titleHint);
                    return targetStore.uploadAsset(settings.targetCollectionId(), assetDirectory, fileName,
                        asset.contentType(), asset.content());
                });
        } catch (RuntimeException e) {
            log.error("Error during asset download/upload for {}", assetUrl, e);
            return Optional.empty();
        }
    }

    private Optional<DownloadedAsset> download(SyncSettings settings, String assetUrl) {
        if (KarakeepUrls.origin(settings.apiEndpoint()).isEmpty()) {
            log.warn("Could not parse API endpoint '{}' to determine asset origin", settings.apiEndpoint());
        }
        boolean authenticated = KarakeepUrls.isSameOrigin(assetUrl, settings.apiEndpoint());

        ResponseEntity<byte[]> response;
        try {
            response = restClient.get()
                .uri(URI.create(assetUrl))
                .headers(headers -> {
                    if (authenticated) {
                        headers.setBearerAuth(settings.apiKey());
                    }
                })
                .retrieve()
                .toEntity(byte[].class);
        } catch (RestClientResponseException e) {
            logFailedDownload(e.getStatusCode().value(), assetUrl, authenticated);
            return Optional.empty();
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            logFailedDownload(response.getStatusCode().value(), assetUrl, authenticated);
            return Optional.empty();
        }
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            log.warn("Asset at {} returned an empty body", assetUrl);
            return Optional.empty();
        }

        MediaType contentType = response.getHeaders().getContentType();
        return Optional.of(new DownloadedAsset(
            body,
            contentType != null ? contentType.toString() : FALLBACK_CONTENT_TYPE
        ));
    }

    private void logFailedDownload(int status, String assetUrl, boolean authenticated) {
        if (status == 404) {
            log.warn("Asset not found (404) at {}", assetUrl);
        } else if (status == 401 || status == 403) {
            log.warn("Authorization error ({}) fetching asset {} ({})", status, assetUrl,
                authenticated ? "auth header sent" : "no auth header sent");
        } else {
            log.error("Failed to download asset ({}) from {}", status, assetUrl);
        }
    }

    static String resolveFileName(String assetUrl, String contentType, String idHint, String titleHint) {
        String fileName = urlFileName(assetUrl);
        if (fileName.isEmpty() || fileName.length() > MAX_URL_FILENAME_LENGTH || !fileName.contains(".")) {
            String extension = extensionFor(contentType, fileName);
            String titlePart = (titleHint == null ? "" : titleHint).replaceAll("[^a-zA-Z0-9_-]", "-");
            if (titlePart.length() > MAX_TITLE_PART_LENGTH) {
                titlePart = titlePart.substring(0, MAX_TITLE_PART_LENGTH);
            }
            String idPart = idHint == null ? "" : idHint.length() > 8 ? idHint.substring(0, 8) : idHint;
            fileName = idPart + "-" + (titlePart.isEmpty() ? "asset" : titlePart) + "." + extension;
        }
        return fileName
            .replaceAll("[\\\\/:*?\"<>|]", "-")
            .replaceAll("\\s", "_");
    }

    static String extensionFor(String contentType, String fallbackFileName) {
        if (contentType != null) {
            String mainType = contentType.split(";")[0].trim().toLowerCase();
            String mapped = EXTENSIONS_BY_CONTENT_TYPE.get(mainType);
            if (mapped != null) {
                return mapped;
            }
        }
        if (fallbackFileName != null && fallbackFileName.contains(".")) {
            String extension = fallbackFileName.substring(fallbackFileName.lastIndexOf('.') + 1);
            if (!extension.isEmpty() && extension.length() < 5) {
                return extension.toLowerCase();
            }
        }
        return "asset";
    }

    private static String urlFileName(String assetUrl) {
        try {
            String path = URI.create(assetUrl).getRawPath();
            if (path == null) {
                return "";
            }
            return path.substring(path.lastIndexOf('/') + 1);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private record DownloadedAsset(byte[] content, String contentType) {}
}
