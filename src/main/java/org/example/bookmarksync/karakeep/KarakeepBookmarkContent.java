package org.example.bookmarksync.karakeep;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bookmark payload. {@code type} selects which fields are meaningful:
 * link (url, title, description, image and screenshot assets, crawled html),
 * text (text), asset (assetType, assetId, fileName, sourceUrl) or unknown.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KarakeepBookmarkContent(
    String type,
    String url,
    String title,
    String description,
    String imageUrl,
    String imageAssetId,
    String screenshotAssetId,
    String htmlContent,
    String text,
    String sourceUrl,
    String assetType,
    String assetId,
    String fileName
) {
    public static final String TYPE_LINK = "link";
    public static final String TYPE_TEXT = "text";
    public static final String TYPE_ASSET = "asset";
    public static final String TYPE_UNKNOWN = "unknown";

    public static KarakeepBookmarkContent unknown() {
        return new KarakeepBookmarkContent(TYPE_UNKNOWN, null, null, null, null, null, null,
            null, null, null, null, null, null);
    }

    public boolean isLink() {
        return TYPE_LINK.equals(type);
    }

    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }

    public boolean isAsset() {
        return TYPE_ASSET.equals(type);
    }

    public boolean isImageAsset() {
        return isAsset() && "image".equals(assetType);
    }

    /**
     * The URL shown for the bookmark: the link itself, or the original location of an
     * uploaded asset.
     */
    public String displayUrl() {
        return isLink() ? url : sourceUrl;
    }

    /**
     * Free text rendered in the body: the link description, or the inline text.
     */
    public String bodyText() {
        return isLink() ? description : text;
    }
}
