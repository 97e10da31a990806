package org.example.bookmarksync.model;

public record SyncResult(
    boolean success,
    String message,
    Outcome outcome,
    int created,
    int updated,
    int skipped,
    int skippedFiltered,
    int errors
) {
    public enum Outcome {
        COMPLETED,
        CONFIGURATION_ERROR,
        CRITICAL_FAILURE,
        ALREADY_RUNNING
    }

    public static SyncResult rejected(String message) {
        return new SyncResult(false, message, Outcome.ALREADY_RUNNING, 0, 0, 0, 0, 0);
    }

    public static SyncResult configurationError(String message) {
        return new SyncResult(false, message, Outcome.CONFIGURATION_ERROR, 0, 0, 0, 0, 0);
    }
}
