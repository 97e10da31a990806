package org.example.bookmarksync.model;

public enum SyncState {
    IDLE,
    RUNNING,
    COMPLETED,
    CRITICAL_FAILURE
}
