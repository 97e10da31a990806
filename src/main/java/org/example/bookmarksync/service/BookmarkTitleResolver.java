package org.example.bookmarksync.service;

import org.example.bookmarksync.karakeep.KarakeepBookmark;
import org.example.bookmarksync.karakeep.KarakeepBookmarkContent;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Picks a document title for a bookmark. An explicit title always wins; otherwise the
 * title is derived from the content, and finally from the bookmark id and date.
 */
@Service
public class BookmarkTitleResolver {

    private static final int MAX_DERIVED_LENGTH = 100;

    public String resolve(KarakeepBookmark bookmark) {
        if (bookmark.title() != null && !bookmark.title().isBlank()) {
            return bookmark.title().trim();
        }

        KarakeepBookmarkContent content = bookmark.content();
        String derived = null;
        if (content.isLink()) {
            derived = fromLink(content);
        } else if (content.isText()) {
            derived = fromText(content.text());
        } else if (content.isAsset()) {
            derived = fromAsset(content);
        }
        if (derived != null && !derived.isBlank()) {
            return derived;
        }

        String idPrefix = bookmark.id().length() > 8 ? bookmark.id().substring(0, 8) : bookmark.id();
        return "Bookmark-" + idPrefix + "-" + DocumentPathBuilder.formatDay(bookmark.createdAt());
    }

    private String fromLink(KarakeepBookmarkContent content) {
        if (content.title() != null && !content.title().isBlank()) {
            return content.title().trim();
        }
        if (content.url() == null || content.url().isBlank()) {
            return null;
        }
        URI uri = parse(content.url());
        if (uri == null) {
            return truncate(content.url());
        }
        String segment = lastPathSegment(uri);
        if (segment != null) {
            String pathTitle = decode(segment)
                .replaceAll("\\.[^/.]+$", "")
                .replaceAll("[-_]", " ")
                .trim();
            if (!pathTitle.isEmpty()) {
                return pathTitle;
            }
        }
        return uri.getHost().replaceFirst("^www\\.", "");
    }

    private String fromText(String text) {
        if (text == null) {
            return null;
        }
        String firstLine = text.split("\n", 2)[0].trim();
        return firstLine.length() <= MAX_DERIVED_LENGTH ? firstLine : firstLine.substring(0, 97) + "...";
    }

    private String fromAsset(KarakeepBookmarkContent content) {
        if (content.fileName() != null && !content.fileName().isBlank()) {
            return content.fileName().replaceAll("\\.[^/.]+$", "").trim();
        }
        if (content.sourceUrl() == null || content.sourceUrl().isBlank()) {
            return null;
        }
        URI uri = parse(content.sourceUrl());
        if (uri == null) {
            return truncate(content.sourceUrl());
        }
        String segment = lastPathSegment(uri);
        return segment != null ? decode(segment) : uri.getHost();
    }

    private static String lastPathSegment(URI uri) {
        String path = uri.getRawPath();
        if (path == null) {
            return null;
        }
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                return segments[i];
            }
        }
        return null;
    }

    private static String decode(String segment) {
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }

    private static URI parse(String url) {
        try {
            URI uri = new URI(url.trim());
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String truncate(String value) {
        return value.length() <= MAX_DERIVED_LENGTH ? value : value.substring(0, MAX_DERIVED_LENGTH);
    }
}
