package org.example.bookmarksync.service;

import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Derives the human-readable document path for a bookmark. Pure: the same title and
 * creation time always give the same path.
 */
@Service
public class DocumentPathBuilder {

    private static final int MAX_TITLE_LENGTH = 60;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    public String buildPath(String title, Instant createdAt) {
        return "/" + buildName(title, createdAt);
    }

    /**
     * Path segment without the leading slash, e.g. {@code 2024-03-01-Hello-World}.
     */
    public String buildName(String title, Instant createdAt) {
        String date = formatDay(createdAt);
        String sanitized = sanitizeTitle(title);
        if (sanitized.isEmpty()) {
            sanitized = "bookmark-" + date;
        }
        return date + "-" + sanitized;
    }

    public String sanitizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String sanitized = title
            .replaceAll("[\\\\/:*?\"<>|#%^&{}\\[\\]\\n\\r\\t]", "-")
            .replaceAll("\\s+", "-")
            .replaceAll("-+", "-")
            .replaceAll("^-+|-+$", "")
            .replaceAll("^\\.+|\\.+$", "");
        if (sanitized.length() > MAX_TITLE_LENGTH) {
            int end = Character.isHighSurrogate(sanitized.charAt(MAX_TITLE_LENGTH - 1))
                ? MAX_TITLE_LENGTH - 1
                : MAX_TITLE_LENGTH;
            sanitized = sanitized.substring(0, end).replaceAll("-+$", "");
        }
        return sanitized;
    }

    public static String formatDay(Instant instant) {
        return DAY.format(instant);
    }
}
