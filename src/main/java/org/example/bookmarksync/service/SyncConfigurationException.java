package org.example.bookmarksync.service;

/**
 * Thrown when a sync cannot start because required settings are missing.
 */
public class SyncConfigurationException extends RuntimeException {

    public SyncConfigurationException(String message) {
        super(message);
    }
}
