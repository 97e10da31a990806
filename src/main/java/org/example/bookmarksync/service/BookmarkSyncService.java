package org.example.bookmarksync.service;

import org.example.bookmarksync.config.SyncSettingsStore;
import org.example.bookmarksync.karakeep.KarakeepBookmark;
import org.example.bookmarksync.karakeep.KarakeepClient;
import org.example.bookmarksync.karakeep.KarakeepPage;
import org.example.bookmarksync.model.SyncResult;
import org.example.bookmarksync.model.SyncSettings;
import org.example.bookmarksync.model.SyncState;
import org.example.bookmarksync.store.DocumentAttributes;
import org.example.bookmarksync.store.TargetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way reconciliation of Karakeep bookmarks into the target store.
 *
 * <p>A run pages through every bookmark oldest first and, one bookmark at a time, either
 * filters it out, creates its document, skips it as up to date, or replaces the document.
 * Replacement deletes the old document before creating the new one at the same path; if
 * the create fails the bookmark has no document until the next run.
 *
 * <p>Only one run executes at a time. A request made while a run is active is rejected,
 * not queued.
 */
@Service
public class BookmarkSyncService {

    private static final Logger log = LoggerFactory.getLogger(BookmarkSyncService.class);

    static final String ALREADY_RUNNING_MESSAGE = "Sync is already in progress.";
    static final String API_KEY_MISSING = "Karakeep API key not configured.";
    static final String COLLECTION_MISSING = "Target SiYuan notebook not configured.";

    public enum ProcessStatus {
        CREATED,
        UPDATED,
        SKIPPED,
        SKIPPED_FILTERED,
        ERROR
    }

    public record ProcessResult(ProcessStatus status, String message) {
        static ProcessResult of(ProcessStatus status) {
            return new ProcessResult(status, null);
        }
    }

    private final KarakeepClient karakeepClient;
    private final TargetStore targetStore;
    private final BookmarkMarkdownFormatter formatter;
    private final BookmarkTitleResolver titleResolver;
    private final DocumentPathBuilder pathBuilder;
    private final SyncSettingsStore settingsStore;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile SyncState state = SyncState.IDLE;
    private volatile SyncResult lastResult;

    public BookmarkSyncService(KarakeepClient karakeepClient,
                               TargetStore targetStore,
                               BookmarkMarkdownFormatter formatter,
                               BookmarkTitleResolver titleResolver,
                               DocumentPathBuilder pathBuilder,
                               SyncSettingsStore settingsStore,
                               Clock clock) {
        this.karakeepClient = karakeepClient;
        this.targetStore = targetStore;
        this.formatter = formatter;
        this.titleResolver = titleResolver;
        this.pathBuilder = pathBuilder;
        this.settingsStore = settingsStore;
        this.clock = clock;
    }

    /**
     * Runs a full sync with the current settings, or rejects the request if a sync is
     * already running. Never throws; failures are reported in the result message.
     */
    public SyncResult runSync() {
        if (!running.compareAndSet(false, true)) {
            log.info("Sync requested while another sync is running; rejected");
            return SyncResult.rejected(ALREADY_RUNNING_MESSAGE);
        }
        state = SyncState.RUNNING;
        try {
            SyncResult result = runCycle(settingsStore.current());
            state = result.outcome() == SyncResult.Outcome.COMPLETED
                ? SyncState.COMPLETED
                : SyncState.CRITICAL_FAILURE;
            lastResult = result;
            log.info("Sync finished. Success: {}, Message: \"{}\"", result.success(), result.message());
            return result;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SyncState getState() {
        return state;
    }

    public Optional<SyncResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    private SyncResult runCycle(SyncSettings settings) {
        try {
            validate(settings);
        } catch (SyncConfigurationException e) {
            log.error("Sync aborted: {}", e.getMessage());
            return SyncResult.configurationError(e.getMessage());
        }

        String collectionId = settings.targetCollectionId();
        log.info("Sync starting. Notebook: {}", collectionId);

        SyncRunStats stats = new SyncRunStats();
        Set<String> processedIds = new HashSet<>();
        try {
            String cursor = null;
            int pageCount = 0;
            do {
                pageCount++;
                KarakeepPage page = karakeepClient.fetchPage(settings, cursor);
                cursor = page.hasNextPage() ? page.nextCursor() : null;
                log.info("Page {}: received {} bookmarks, has next page: {}",
                    pageCount, page.bookmarks().size(), cursor != null);

                for (KarakeepBookmark bookmark : page.bookmarks()) {
                    if (!processedIds.add(bookmark.id())) {
                        log.warn("Duplicate bookmark ID {} encountered in pagination. Skipping.", bookmark.id());
                        continue;
                    }
                    ProcessResult result = processBookmark(settings, collectionId, bookmark);
                    stats.record(result.status());
                    if (result.status() == ProcessStatus.ERROR) {
                        log.error("Error processing bookmark {}: {}", bookmark.id(), result.message());
                    }
                }
                log.info("Finished page {}. Stats: {}", pageCount, stats);
            } while (cursor != null);
        } catch (RuntimeException e) {
            log.error("Critical error during sync after {} bookmarks", processedIds.size(), e);
            stats.recordCriticalError();
            String reason = e.getMessage() != null ? e.getMessage() : "Unknown error";
            return stats.toCriticalResult("Sync failed critically: " + reason);
        }

        SyncResult result = stats.toCompletedResult();
        try {
            settingsStore.recordLastSync(clock.millis(), result.success());
        } catch (UncheckedIOException e) {
            log.error("Sync completed but the last sync time could not be saved", e);
        }
        return result;
    }

    private void validate(SyncSettings settings) {
        if (!settings.hasApiKey()) {
            throw new SyncConfigurationException(API_KEY_MISSING);
        }
        if (!settings.hasTargetCollection()) {
            throw new SyncConfigurationException(COLLECTION_MISSING);
        }
    }

    ProcessResult processBookmark(SyncSettings settings, String collectionId, KarakeepBookmark bookmark) {
        Optional<String> filterReason = filterReason(settings, bookmark);
        if (filterReason.isPresent()) {
            log.debug("Bookmark {} filtered: {}", bookmark.id(), filterReason.get());
            return new ProcessResult(ProcessStatus.SKIPPED_FILTERED, filterReason.get());
        }

        String path = null;
        try {
            String title = titleResolver.resolve(bookmark);
            path = pathBuilder.buildPath(title, bookmark.createdAt());

            // Matching is by bookmark id only; two bookmarks may share a path.
            Optional<String> existingDocId = targetStore.findDocumentByExternalId(collectionId, bookmark.id());
            if (existingDocId.isEmpty()) {
                log.info("Creating new document for bookmark {} at {}:{}", bookmark.id(), collectionId, path);
                return createDocument(settings, collectionId, bookmark, title, path);
            }

            String docId = existingDocId.get();
            if (!shouldUpdate(settings, docId, bookmark)) {
                log.debug("Skipping existing document {} (up to date or updates disabled)", docId);
                return new ProcessResult(ProcessStatus.SKIPPED, "Exists, no update needed");
            }
            log.info("Updating document {} for bookmark {} at {}", docId, bookmark.id(), path);
            return replaceDocument(settings, collectionId, docId, bookmark, title, path);
        } catch (RuntimeException e) {
            log.error("Failed to process bookmark {} (path: {})", bookmark.id(), path, e);
            return new ProcessResult(ProcessStatus.ERROR,
                e.getMessage() != null ? e.getMessage() : "Unknown processing error");
        }
    }

    /**
     * Filters apply in order: archived, not favourite, excluded tag. Favourites are never
     * dropped for their tags.
     */
    private Optional<String> filterReason(SyncSettings settings, KarakeepBookmark bookmark) {
        if (settings.excludeArchived() && bookmark.archived()) {
            return Optional.of("Archived");
        }
        if (settings.onlyFavorites() && !bookmark.favourited()) {
            return Optional.of("Not favorite");
        }
        if (!bookmark.favourited()) {
            for (String excluded : settings.excludedTags()) {
                String tag = excluded == null ? "" : excluded.trim();
                if (!tag.isEmpty() && bookmark.hasTag(tag)) {
                    return Optional.of("Excluded tag");
                }
            }
        }
        return Optional.empty();
    }

    /**
     * An existing document is replaced when updates are enabled and either it has no stored
     * modification time or the bookmark changed after it. Unreadable attributes count as
     * stale.
     */
    private boolean shouldUpdate(SyncSettings settings, String docId, KarakeepBookmark bookmark) {
        if (!settings.updateExistingFiles()) {
            return false;
        }

        Optional<Map<String, String>> attributes = targetStore.getAttributes(docId);
        if (attributes.isEmpty()) {
            log.warn("Could not get attributes for existing doc {}. Assuming update needed.", docId);
            return true;
        }

        Instant stored = parseInstant(attributes.get().get(DocumentAttributes.MODIFIED));
        Instant modified = bookmark.effectiveModifiedAt();
        if (stored == null || modified.isAfter(stored)) {
            log.info("Marking doc {} for update (bookmark modified: {}, stored: {})", docId, modified, stored);
            return true;
        }
        return false;
    }

    private ProcessResult createDocument(SyncSettings settings, String collectionId, KarakeepBookmark bookmark,
                                         String title, String path) {
        try {
            String markdown = formatter.format(settings, bookmark, title);
            Optional<String> docId = targetStore.createDocument(collectionId, path, markdown);
            if (docId.isEmpty()) {
                return new ProcessResult(ProcessStatus.ERROR, "Failed to create document via API.");
            }
            targetStore.setAttributes(docId.get(), buildAttributes(bookmark, title));
            return ProcessResult.of(ProcessStatus.CREATED);
        } catch (RuntimeException e) {
            log.error("Error during document creation for bookmark {}", bookmark.id(), e);
            return new ProcessResult(ProcessStatus.ERROR,
                e.getMessage() != null ? e.getMessage() : "Document creation failed");
        }
    }

    private ProcessResult replaceDocument(SyncSettings settings, String collectionId, String existingDocId,
                                          KarakeepBookmark bookmark, String title, String path) {
        if (!targetStore.deleteDocument(existingDocId)) {
            return new ProcessResult(ProcessStatus.ERROR, "Failed to delete old doc " + existingDocId);
        }
        log.info("Deleted existing doc {}. Recreating...", existingDocId);

        ProcessResult created = createDocument(settings, collectionId, bookmark, title, path);
        if (created.status() == ProcessStatus.CREATED) {
            return ProcessResult.of(ProcessStatus.UPDATED);
        }
        log.error("Failed to recreate document after deletion for bookmark {}. Previous ID was {}.",
            bookmark.id(), existingDocId);
        return created;
    }

    static Map<String, String> buildAttributes(KarakeepBookmark bookmark, String title) {
        String url = bookmark.content().displayUrl();
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(DocumentAttributes.EXTERNAL_ID, bookmark.id());
        attributes.put(DocumentAttributes.MODIFIED, bookmark.effectiveModifiedAt().toString());
        attributes.put(DocumentAttributes.TITLE, title);
        attributes.put(DocumentAttributes.URL, url == null ? "" : url);
        attributes.put(DocumentAttributes.CREATED, bookmark.createdAt().toString());
        attributes.put(DocumentAttributes.TAGS, String.join(", ", bookmark.tagNames()));
        attributes.put(DocumentAttributes.SUMMARY, bookmark.summary() == null ? "" : bookmark.summary());
        attributes.put(DocumentAttributes.FAVOURITED, String.valueOf(bookmark.favourited()));
        attributes.put(DocumentAttributes.ARCHIVED, String.valueOf(bookmark.archived()));
        return attributes;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
