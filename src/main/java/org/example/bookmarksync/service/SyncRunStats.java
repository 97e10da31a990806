package org.example.bookmarksync.service;

import org.example.bookmarksync.model.SyncResult;
import org.example.bookmarksync.model.SyncResult.Outcome;
import org.example.bookmarksync.service.BookmarkSyncService.ProcessStatus;

/**
 * Counters for a single sync run.
 */
public class SyncRunStats {

    private int created;
    private int updated;
    private int skipped;
    private int skippedFiltered;
    private int errors;

    public void record(ProcessStatus status) {
        switch (status) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case SKIPPED -> skipped++;
            case SKIPPED_FILTERED -> skippedFiltered++;
            case ERROR -> errors++;
        }
    }

    public void recordCriticalError() {
        errors++;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getSkippedFiltered() {
        return skippedFiltered;
    }

    public int getErrors() {
        return errors;
    }

    /**
     * e.g. {@code "Sync complete: 2 created, 1 updated, 5 skipped (3 filtered), 1 errors (check logs)"}.
     * The skipped count includes filtered bookmarks.
     */
    public String summaryMessage() {
        StringBuilder message = new StringBuilder("Sync complete: ")
            .append(created).append(" created, ")
            .append(updated).append(" updated, ")
            .append(skipped + skippedFiltered).append(" skipped");
        if (skippedFiltered > 0) {
            message.append(" (").append(skippedFiltered).append(" filtered)");
        }
        if (errors > 0) {
            message.append(", ").append(errors).append(" errors (check logs)");
        }
        return message.toString();
    }

    public SyncResult toCompletedResult() {
        return toResult(Outcome.COMPLETED, summaryMessage());
    }

    public SyncResult toCriticalResult(String message) {
        return toResult(Outcome.CRITICAL_FAILURE, message);
    }

    private SyncResult toResult(Outcome outcome, String message) {
        boolean success = outcome == Outcome.COMPLETED && errors == 0;
        return new SyncResult(success, message, outcome, created, updated, skipped, skippedFiltered, errors);
    }

    @Override
    public String toString() {
        return "C=" + created + ", U=" + updated + ", S=" + skipped + ", SF=" + skippedFiltered + ", E=" + errors;
    }
}
