package org.example.bookmarksync.store;

import org.example.bookmarksync.model.TargetCollection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document store the bookmarks are written into. Every call is independent and stateless;
 * implementations log their own failures and report them through the return value, except
 * where a method documents {@link TargetStoreException}.
 */
public interface TargetStore {

    /**
     * Finds the document in {@code collectionId} whose external-id attribute equals
     * {@code externalId}. Empty when absent or when the store rejects the query.
     *
     * @throws TargetStoreException when the store cannot be reached
     */
    Optional<String> findDocumentByExternalId(String collectionId, String externalId);

    Optional<Map<String, String>> getAttributes(String documentId);

    /**
     * Best effort; failures are logged and not reported.
     */
    void setAttributes(String documentId, Map<String, String> attributes);

    Optional<String> createDocument(String collectionId, String path, String markdown);

    boolean deleteDocument(String documentId);

    /**
     * Uploads a binary asset and returns the store-relative reference usable in Markdown.
     */
    Optional<String> uploadAsset(String collectionId, String assetDirectory, String fileName,
                                 String contentType, byte[] content);

    /**
     * @throws TargetStoreException when the collections cannot be listed
     */
    List<TargetCollection> listCollections();
}
