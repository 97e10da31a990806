package org.example.bookmarksync.store;

public class TargetStoreException extends RuntimeException {

    public TargetStoreException(String message) {
        super(message);
    }

    public TargetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
