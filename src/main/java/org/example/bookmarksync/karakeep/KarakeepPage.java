package org.example.bookmarksync.karakeep;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KarakeepPage(
    List<KarakeepBookmark> bookmarks,
    int total,
    String nextCursor
) {
    public KarakeepPage {
        bookmarks = bookmarks == null ? List.of() : bookmarks;
    }

    public boolean hasNextPage() {
        return nextCursor != null && !nextCursor.isEmpty();
    }
}
