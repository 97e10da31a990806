package org.example.bookmarksync.service;

import org.example.bookmarksync.karakeep.KarakeepBookmark;
import org.example.bookmarksync.karakeep.KarakeepBookmarkContent;
import org.example.bookmarksync.karakeep.KarakeepUrls;
import org.example.bookmarksync.model.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders a bookmark as the Markdown body of its document.
 *
 * <p>Sections, each only when there is data for it: title, embedded asset, URL, summary,
 * description or text, tags, notes (always present so users have a place to write),
 * converted page snapshot, and a link back to Karakeep.
 */
@Service
public class BookmarkMarkdownFormatter {

    private static final Logger log = LoggerFactory.getLogger(BookmarkMarkdownFormatter.class);

    static final String VIEW_ON_KARAKEEP = "View in Karakeep";
    static final String ASSET_DOWNLOAD_FAILED = "Failed to download asset: View on Karakeep";

    private final AssetRehostService assetRehostService;
    private final HtmlMarkdownConverter htmlMarkdownConverter;

    public BookmarkMarkdownFormatter(AssetRehostService assetRehostService,
                                     HtmlMarkdownConverter htmlMarkdownConverter) {
        this.assetRehostService = assetRehostService;
        this.htmlMarkdownConverter = htmlMarkdownConverter;
    }

    public String format(SyncSettings settings, KarakeepBookmark bookmark, String title) {
        KarakeepBookmarkContent content = bookmark.content();
        StringBuilder markdown = new StringBuilder();

        markdown.append("# ").append(title).append("\n\n");
        markdown.append(formatAsset(settings, bookmark, title));

        String url = content.displayUrl();
        if (url != null && !url.isBlank() && !content.isAsset()) {
            markdown.append("**URL:** [").append(url).append("](").append(url).append(")\n\n");
        }
        if (bookmark.summary() != null && !bookmark.summary().isBlank()) {
            section(markdown, "Summary", bookmark.summary().trim());
        }
        String bodyText = content.bodyText();
        if (bodyText != null && !bodyText.isBlank()) {
            section(markdown, content.isText() ? "Text Content" : "Description", bodyText.trim());
        }
        if (!bookmark.tagNames().isEmpty()) {
            String tags = bookmark.tagNames().stream()
                .map(name -> "#" + name.replaceAll("\\s+", "-"))
                .collect(Collectors.joining(" "));
            markdown.append("**Tags:** ").append(tags).append("\n\n");
        }
        section(markdown, "Notes", bookmark.note() == null ? "" : bookmark.note());

        convertSnapshot(bookmark).ifPresent(snapshot -> section(markdown, "Content Snapshot", snapshot));

        markdown.append("----\n");
        Optional<String> previewUrl = KarakeepUrls.previewUrl(settings.apiEndpoint(), bookmark.id());
        if (previewUrl.isPresent()) {
            markdown.append('[').append(VIEW_ON_KARAKEEP).append("](").append(previewUrl.get()).append(')');
        } else {
            log.warn("Could not determine Karakeep base URL from endpoint: {}", settings.apiEndpoint());
            markdown.append("Karakeep ID: ").append(bookmark.id());
        }
        return markdown.toString();
    }

    private String formatAsset(SyncSettings settings, KarakeepBookmark bookmark, String title) {
        AssetReference asset = resolveAsset(settings, bookmark, title);
        if (asset == null) {
            return "";
        }
        if (!settings.downloadAssets()) {
            return "![" + asset.description() + "](" + asset.url() + ")\n\n";
        }
        return assetRehostService.fetchAndRehost(settings, asset.url(), asset.idHint(), asset.description())
            .map(localRef -> "![" + asset.description() + "](" + localRef + ")\n\n")
            .orElseGet(() -> "[" + ASSET_DOWNLOAD_FAILED + "](" + asset.url() + ")\n\n");
    }

    /**
     * First match wins: uploaded image asset, link image asset, link screenshot, bare image URL.
     */
    private AssetReference resolveAsset(SyncSettings settings, KarakeepBookmark bookmark, String title) {
        KarakeepBookmarkContent content = bookmark.content();
        String description = title == null || title.isBlank() ? "asset" : title;

        if (content.isImageAsset() && hasText(content.assetId())) {
            return karakeepAsset(settings, content.assetId(), description);
        }
        if (content.isLink()) {
            if (hasText(content.imageAssetId())) {
                return karakeepAsset(settings, content.imageAssetId(), description);
            }
            if (hasText(content.screenshotAssetId())) {
                return karakeepAsset(settings, content.screenshotAssetId(), description);
            }
        }
        if (hasText(content.imageUrl())) {
            return new AssetReference(content.imageUrl(), bookmark.id(), title == null || title.isBlank() ? "image" : title);
        }
        return null;
    }

    private AssetReference karakeepAsset(SyncSettings settings, String assetId, String description) {
        return KarakeepUrls.assetUrl(settings.apiEndpoint(), assetId)
            .map(url -> new AssetReference(url, assetId, description))
            .orElseGet(() -> {
                log.warn("Could not parse Karakeep API endpoint ({}) to build asset URL", settings.apiEndpoint());
                return null;
            });
    }

    private Optional<String> convertSnapshot(KarakeepBookmark bookmark) {
        String html = bookmark.content().htmlContent();
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        try {
            String converted = htmlMarkdownConverter.convert(html);
            if (converted == null || converted.isBlank()) {
                log.info("HTML conversion produced no content for bookmark {}", bookmark.id());
                return Optional.empty();
            }
            return Optional.of(converted.trim());
        } catch (RuntimeException e) {
            log.error("Error converting htmlContent for bookmark {}", bookmark.id(), e);
            return Optional.empty();
        }
    }

    private static void section(StringBuilder markdown, String heading, String body) {
        markdown.append("## ").append(heading).append("\n\n").append(body).append("\n\n");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record AssetReference(String url, String idHint, String description) {}
}
