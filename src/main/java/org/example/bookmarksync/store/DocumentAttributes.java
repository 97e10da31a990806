package org.example.bookmarksync.store;

/**
 * Attribute names written on every synced document.
 */
public final class DocumentAttributes {

    public static final String PREFIX = "custom-karakeep-";

    /** Karakeep bookmark id; the only key used to match a bookmark to its document. */
    public static final String EXTERNAL_ID = PREFIX + "id";
    /** ISO-8601 modification time of the bookmark version the document was rendered from. */
    public static final String MODIFIED = PREFIX + "modified";

    public static final String TITLE = "title";
    public static final String URL = PREFIX + "url";
    public static final String CREATED = PREFIX + "created";
    public static final String TAGS = PREFIX + "tags";
    public static final String SUMMARY = PREFIX + "summary";
    public static final String FAVOURITED = PREFIX + "favourited";
    public static final String ARCHIVED = PREFIX + "archived";

    private DocumentAttributes() {
    }
}
