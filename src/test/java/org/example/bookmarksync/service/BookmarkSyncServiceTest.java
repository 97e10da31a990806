package org.example.bookmarksync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.bookmarksync.config.SyncSettingsStore;
import org.example.bookmarksync.karakeep.KarakeepBookmark;
import org.example.bookmarksync.karakeep.KarakeepBookmarkContent;
import org.example.bookmarksync.karakeep.KarakeepClient;
import org.example.bookmarksync.karakeep.KarakeepPage;
import org.example.bookmarksync.karakeep.SourceUnavailableException;
import org.example.bookmarksync.model.SyncResult;
import org.example.bookmarksync.model.SyncSettings;
import org.example.bookmarksync.model.SyncState;
import org.example.bookmarksync.store.DocumentAttributes;
import org.example.bookmarksync.store.InMemoryTargetStore;
import org.example.bookmarksync.store.InMemoryTargetStore.StoredDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookmarkSyncServiceTest {

    private static final String NOTEBOOK = "nb-1";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private KarakeepClient karakeepClient;

    @Mock
    private BookmarkMarkdownFormatter formatter;

    @TempDir
    Path tempDir;

    private InMemoryTargetStore targetStore;
    private Path settingsFile;

    @BeforeEach
    void setUp() {
        targetStore = new InMemoryTargetStore();
        settingsFile = tempDir.resolve("settings.json");
        lenient().when(formatter.format(any(), any(), anyString())).thenReturn("# body");
    }

    @Test
    void createsDocumentsWithAttributesForNewBookmarks() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        KarakeepBookmark bookmark = linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "Hello/World??");
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null, bookmark));

        SyncResult result = service.runSync();

        assertTrue(result.success());
        assertEquals(SyncResult.Outcome.COMPLETED, result.outcome());
        assertEquals(1, result.created());
        assertEquals("Sync complete: 1 created, 0 updated, 0 skipped", result.message());

        StoredDocument document = targetStore.documents().values().iterator().next();
        assertEquals(NOTEBOOK, document.collectionId());
        assertEquals("/2024-03-01-Hello-World", document.path());
        assertEquals("# body", document.markdown());
        assertEquals("bm-1", document.attributes().get(DocumentAttributes.EXTERNAL_ID));
        assertEquals("2024-03-01T10:00:00Z", document.attributes().get(DocumentAttributes.MODIFIED));
        assertEquals("Hello/World??", document.attributes().get(DocumentAttributes.TITLE));
        assertEquals("https://example.com/article", document.attributes().get(DocumentAttributes.URL));
    }

    @Test
    void secondRunWithoutChangesCreatesNothing() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "One"),
            linkBookmark("bm-2", "2024-03-02T10:00:00Z", null, "Two")));

        service.runSync();
        SyncResult second = service.runSync();

        assertEquals(0, second.created());
        assertEquals(2, second.skipped());
        assertEquals(2, targetStore.createCalls);
        assertEquals(2, targetStore.documentCount());
    }

    @Test
    void favouriteWithExcludedTagIsStillSynced() {
        BookmarkSyncService service = service(settings(false, true, false, List.of("private")));
        KarakeepBookmark favourite = bookmark("bm-fav", false, true, List.of(tag("Private")));
        KarakeepBookmark plain = bookmark("bm-plain", false, false, List.of(tag("private")));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null, favourite, plain));

        SyncResult result = service.runSync();

        assertEquals(1, result.created());
        assertEquals(1, result.skippedFiltered());
        assertTrue(targetStore.findDocumentByExternalId(NOTEBOOK, "bm-fav").isPresent());
        assertTrue(targetStore.findDocumentByExternalId(NOTEBOOK, "bm-plain").isEmpty());
        assertEquals("Sync complete: 1 created, 0 updated, 1 skipped (1 filtered)", result.message());
    }

    @Test
    void archivedAndNonFavouriteBookmarksAreFiltered() {
        BookmarkSyncService service = service(settings(false, true, true, List.of()));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            bookmark("bm-archived", true, true, List.of()),
            bookmark("bm-regular", false, false, List.of()),
            bookmark("bm-fav", false, true, List.of())));

        SyncResult result = service.runSync();

        assertEquals(1, result.created());
        assertEquals(2, result.skippedFiltered());
        assertEquals(0, result.skipped());
        assertEquals(1, targetStore.documentCount());
    }

    @Test
    void replacesDocumentWhenBookmarkChangedAfterStoredModification() {
        BookmarkSyncService service = service(settings(true, true, false, List.of()));
        String oldId = targetStore.seed(NOTEBOOK, "/2024-03-01-Old", "bm-1", "2024-03-01T10:00:00Z");
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", "2024-04-01T08:00:00Z", "Edited")));

        SyncResult result = service.runSync();

        assertEquals(1, result.updated());
        assertEquals(1, targetStore.deleteCalls);
        assertEquals(1, targetStore.documentCount());
        assertFalse(targetStore.documents().containsKey(oldId));
        StoredDocument document = targetStore.documents().values().iterator().next();
        assertEquals("/2024-03-01-Edited", document.path());
        assertEquals("2024-04-01T08:00:00Z", document.attributes().get(DocumentAttributes.MODIFIED));
    }

    @Test
    void skipsDocumentWhenStoredModificationIsCurrent() {
        BookmarkSyncService service = service(settings(true, true, false, List.of()));
        targetStore.seed(NOTEBOOK, "/2024-03-01-Same", "bm-1", "2024-04-01T08:00:00Z");
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", "2024-04-01T08:00:00Z", "Same")));

        SyncResult result = service.runSync();

        assertEquals(1, result.skipped());
        assertEquals(0, targetStore.deleteCalls);
        assertEquals(0, targetStore.createCalls);
    }

    @Test
    void skipsChangedBookmarkWhenUpdatesAreDisabled() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        targetStore.seed(NOTEBOOK, "/2024-03-01-Old", "bm-1", "2024-03-01T10:00:00Z");
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", "2024-04-01T08:00:00Z", "Edited")));

        SyncResult result = service.runSync();

        assertEquals(1, result.skipped());
        assertEquals(0, targetStore.deleteCalls);
    }

    @Test
    void unreadableAttributesOrMissingModificationTriggerUpdate() {
        BookmarkSyncService service = service(settings(true, true, false, List.of()));
        targetStore.seed(NOTEBOOK, "/a", "bm-1", "2024-09-01T00:00:00Z");
        targetStore.seed(NOTEBOOK, "/b", "bm-2", null);
        targetStore.failGetAttributes = true;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "A")));

        assertEquals(1, service.runSync().updated());

        targetStore.failGetAttributes = false;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-2", "2024-03-01T10:00:00Z", null, "B")));

        assertEquals(1, service.runSync().updated());
    }

    @Test
    void failedRecreateLeavesBookmarkWithoutDocument() {
        BookmarkSyncService service = service(settings(true, true, false, List.of()));
        targetStore.seed(NOTEBOOK, "/2024-03-01-Old", "bm-1", "2024-03-01T10:00:00Z");
        targetStore.failCreate = true;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", "2024-04-01T08:00:00Z", "Edited")));

        SyncResult result = service.runSync();

        assertFalse(result.success());
        assertEquals(1, result.errors());
        assertEquals(0, targetStore.documentCount());
        assertEquals("Sync complete: 0 created, 0 updated, 0 skipped, 1 errors (check logs)", result.message());
    }

    @Test
    void failedDeleteKeepsOldDocumentAndCountsError() {
        BookmarkSyncService service = service(settings(true, true, false, List.of()));
        targetStore.seed(NOTEBOOK, "/2024-03-01-Old", "bm-1", "2024-03-01T10:00:00Z");
        targetStore.failDelete = true;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", "2024-04-01T08:00:00Z", "Edited")));

        SyncResult result = service.runSync();

        assertEquals(1, result.errors());
        assertEquals(0, targetStore.createCalls);
        assertEquals(1, targetStore.documentCount());
    }

    @Test
    void lookupFailureIsRecordErrorAndDoesNotCreate() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        targetStore.failLookup = true;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "One"),
            linkBookmark("bm-2", "2024-03-02T10:00:00Z", null, "Two")));

        SyncResult result = service.runSync();

        assertEquals(SyncResult.Outcome.COMPLETED, result.outcome());
        assertEquals(2, result.errors());
        assertEquals(0, targetStore.createCalls);
    }

    @Test
    void followsCursorAndIgnoresDuplicateIdsAcrossPages() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page("cursor-2",
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "One"),
            linkBookmark("bm-2", "2024-03-02T10:00:00Z", null, "Two")));
        when(karakeepClient.fetchPage(any(SyncSettings.class), eq("cursor-2"))).thenReturn(page(null,
            linkBookmark("bm-2", "2024-03-02T10:00:00Z", null, "Two"),
            linkBookmark("bm-3", "2024-03-03T10:00:00Z", null, "Three")));

        SyncResult result = service.runSync();

        assertEquals(3, result.created());
        assertEquals(0, result.skipped());
        assertEquals(3, targetStore.createCalls);
        verify(karakeepClient, times(2)).fetchPage(any(SyncSettings.class), any());
    }

    @Test
    void missingApiKeyFailsWithoutNetworkCalls() {
        SyncSettings settings = new SyncSettings("", "https://karakeep.example.com/api/v1", NOTEBOOK,
            60, 0L, false, true, false, List.of(), true);
        BookmarkSyncService service = service(settings);

        SyncResult result = service.runSync();

        assertFalse(result.success());
        assertEquals(SyncResult.Outcome.CONFIGURATION_ERROR, result.outcome());
        assertEquals(BookmarkSyncService.API_KEY_MISSING, result.message());
        assertEquals(SyncState.CRITICAL_FAILURE, service.getState());
        verifyNoInteractions(karakeepClient);
        assertEquals(0, targetStore.createCalls);
    }

    @Test
    void missingNotebookFailsWithoutNetworkCalls() {
        SyncSettings settings = new SyncSettings("key", "https://karakeep.example.com/api/v1", " ",
            60, 0L, false, true, false, List.of(), true);

        SyncResult result = service(settings).runSync();

        assertEquals(BookmarkSyncService.COLLECTION_MISSING, result.message());
        verifyNoInteractions(karakeepClient);
    }

    @Test
    void sourceFailureMidRunIsCriticalAndKeepsLastSyncTime() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page("cursor-2",
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "One")));
        when(karakeepClient.fetchPage(any(SyncSettings.class), eq("cursor-2")))
            .thenThrow(new SourceUnavailableException(500, "boom"));

        SyncResult result = service.runSync();

        assertFalse(result.success());
        assertEquals(SyncResult.Outcome.CRITICAL_FAILURE, result.outcome());
        assertEquals("Sync failed critically: Karakeep API request failed: 500 boom", result.message());
        assertEquals(1, result.created());
        assertEquals(1, result.errors());
        assertEquals(1, targetStore.documentCount());
        assertEquals(SyncState.CRITICAL_FAILURE, service.getState());
        assertFalse(Files.exists(settingsFile));
    }

    @Test
    void successfulRunPersistsLastSyncTime() throws Exception {
        SyncSettingsStore settingsStore = settingsStore(settings(false, true, false, List.of()));
        BookmarkSyncService service = service(settingsStore);
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null));

        SyncResult result = service.runSync();

        assertTrue(result.success());
        assertEquals(NOW.toEpochMilli(), settingsStore.current().lastSyncTimestamp());
        assertTrue(Files.exists(settingsFile));
        assertTrue(Files.readString(settingsFile).contains(String.valueOf(NOW.toEpochMilli())));
        assertEquals(SyncState.COMPLETED, service.getState());
        assertEquals(Optional.of(result), service.getLastResult());
    }

    @Test
    void runWithRecordErrorsDoesNotPersistLastSyncTime() {
        SyncSettingsStore settingsStore = settingsStore(settings(false, true, false, List.of()));
        BookmarkSyncService service = service(settingsStore);
        targetStore.failCreate = true;
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "One")));

        SyncResult result = service.runSync();

        assertEquals(SyncResult.Outcome.COMPLETED, result.outcome());
        assertFalse(result.success());
        assertEquals(NOW.toEpochMilli(), settingsStore.current().lastSyncTimestamp());
        assertFalse(Files.exists(settingsFile));
    }

    @Test
    void formatterFailureIsRecordError() {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        when(formatter.format(any(), any(), eq("Broken"))).thenThrow(new IllegalStateException("render failed"));
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null,
            linkBookmark("bm-1", "2024-03-01T10:00:00Z", null, "Broken"),
            linkBookmark("bm-2", "2024-03-02T10:00:00Z", null, "Fine")));

        SyncResult result = service.runSync();

        assertEquals(1, result.errors());
        assertEquals(1, result.created());
    }

    @Test
    void missingAssetStillCreatesDocumentWithFallbackLink() {
        AssetRehostService assetRehostService = mock(AssetRehostService.class);
        when(assetRehostService.fetchAndRehost(any(), anyString(), anyString(), anyString())).thenReturn(Optional.empty());
        BookmarkMarkdownFormatter realFormatter =
            new BookmarkMarkdownFormatter(assetRehostService, new JsoupHtmlMarkdownConverter());
        SyncSettingsStore settingsStore = settingsStore(settings(false, true, false, List.of()));
        BookmarkSyncService service = new BookmarkSyncService(karakeepClient, targetStore, realFormatter,
            new BookmarkTitleResolver(), new DocumentPathBuilder(), settingsStore,
            Clock.fixed(NOW, ZoneOffset.UTC));

        KarakeepBookmarkContent content = new KarakeepBookmarkContent(KarakeepBookmarkContent.TYPE_ASSET,
            null, null, null, null, null, null, null, null, null, "image", "asset-404", "photo.png");
        KarakeepBookmark bookmark = new KarakeepBookmark("bm-img", Instant.parse("2024-03-01T10:00:00Z"), null,
            null, false, false, null, null, null, List.of(), content);
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenReturn(page(null, bookmark));

        SyncResult result = service.runSync();

        assertEquals(1, result.created());
        StoredDocument document = targetStore.documents().values().iterator().next();
        assertEquals("/2024-03-01-photo", document.path());
        assertTrue(document.markdown().contains(
            "[Failed to download asset: View on Karakeep](https://karakeep.example.com/assets/asset-404)"));
    }

    @Test
    void rejectsSyncWhileAnotherIsRunning() throws Exception {
        BookmarkSyncService service = service(settings(false, true, false, List.of()));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(karakeepClient.fetchPage(any(SyncSettings.class), isNull())).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return page(null);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncResult> first = executor.submit(service::runSync);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(service.isRunning());
            assertEquals(SyncState.RUNNING, service.getState());

            SyncResult rejected = service.runSync();

            assertFalse(rejected.success());
            assertEquals(SyncResult.Outcome.ALREADY_RUNNING, rejected.outcome());
            assertEquals(BookmarkSyncService.ALREADY_RUNNING_MESSAGE, rejected.message());

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).success());
            assertFalse(service.isRunning());
        } finally {
            executor.shutdownNow();
        }
        verify(karakeepClient, times(1)).fetchPage(any(SyncSettings.class), any());
    }

    @Test
    void buildAttributesUsesCreatedAtWhenModifiedAtMissing() {
        KarakeepBookmark bookmark = new KarakeepBookmark("bm-1", Instant.parse("2024-03-01T10:00:00Z"), null,
            null, true, false, null, null, "short summary", List.of(tag("a"), tag("b c")),
            new KarakeepBookmarkContent(KarakeepBookmarkContent.TYPE_TEXT, null, null, null, null, null, null,
                null, "note body", null, null, null, null));

        Map<String, String> attributes = BookmarkSyncService.buildAttributes(bookmark, "note body");

        assertEquals("2024-03-01T10:00:00Z", attributes.get(DocumentAttributes.MODIFIED));
        assertEquals("", attributes.get(DocumentAttributes.URL));
        assertEquals("a, b c", attributes.get(DocumentAttributes.TAGS));
        assertEquals("short summary", attributes.get(DocumentAttributes.SUMMARY));
        assertEquals("true", attributes.get(DocumentAttributes.ARCHIVED));
        assertEquals("false", attributes.get(DocumentAttributes.FAVOURITED));
    }

    private BookmarkSyncService service(SyncSettings settings) {
        return service(settingsStore(settings));
    }

    private BookmarkSyncService service(SyncSettingsStore settingsStore) {
        return new BookmarkSyncService(karakeepClient, targetStore, formatter, new BookmarkTitleResolver(),
            new DocumentPathBuilder(), settingsStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SyncSettingsStore settingsStore(SyncSettings settings) {
        return new SyncSettingsStore(settingsFile, settings, new ObjectMapper());
    }

    private static SyncSettings settings(boolean updateExisting, boolean excludeArchived, boolean onlyFavorites,
                                         List<String> excludedTags) {
        return new SyncSettings("key", "https://karakeep.example.com/api/v1", NOTEBOOK, 60, 0L,
            updateExisting, excludeArchived, onlyFavorites, excludedTags, true);
    }

    private static KarakeepPage page(String nextCursor, KarakeepBookmark... bookmarks) {
        return new KarakeepPage(List.of(bookmarks), bookmarks.length, nextCursor);
    }

    private static KarakeepBookmark linkBookmark(String id, String createdAt, String modifiedAt, String title) {
        return new KarakeepBookmark(id, Instant.parse(createdAt), modifiedAt == null ? null : Instant.parse(modifiedAt),
            title, false, false, null, null, null, List.of(), linkContent());
    }

    private static KarakeepBookmark bookmark(String id, boolean archived, boolean favourited,
                                             List<KarakeepBookmark.Tag> tags) {
        return new KarakeepBookmark(id, Instant.parse("2024-03-01T10:00:00Z"), null, id, archived, favourited,
            null, null, null, tags, linkContent());
    }

    private static KarakeepBookmarkContent linkContent() {
        return new KarakeepBookmarkContent(KarakeepBookmarkContent.TYPE_LINK, "https://example.com/article",
            null, null, null, null, null, null, null, null, null, null, null);
    }

    private static KarakeepBookmark.Tag tag(String name) {
        return new KarakeepBookmark.Tag("tag-" + name, name, "human");
    }
}
