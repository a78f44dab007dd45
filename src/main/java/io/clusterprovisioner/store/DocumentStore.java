package io.clusterprovisioner.store;

import io.clusterprovisioner.models.ClusterDocument;

import java.util.List;

/**
 * Persistence for cluster documents with compare-and-swap writes.
 * Every document returned carries the concurrency token it was read at;
 * writes and deletes are rejected when the stored token has moved on.
 */
public interface DocumentStore {

    /**
     * Insert a new document.
     *
     * @return the document with its initial concurrency token
     * @throws ConcurrencyConflictException if a document with the same key exists
     */
    ClusterDocument create(ClusterDocument document) throws DocumentStoreException;

    /**
     * Point read by key. The key is normalized before lookup.
     *
     * @throws DocumentNotFoundException if no document exists for the key
     */
    ClusterDocument get(String key) throws DocumentStoreException;

    /**
     * All stored documents.
     */
    List<ClusterDocument> list() throws DocumentStoreException;

    /**
     * Conditional update guarded by {@code document.getConcurrencyToken()}.
     *
     * @return the written document carrying its new token
     * @throws ConcurrencyConflictException if the stored token differs
     * @throws DocumentNotFoundException if the document was deleted
     */
    ClusterDocument write(ClusterDocument document) throws DocumentStoreException;

    /**
     * Conditional delete guarded by {@code document.getConcurrencyToken()}.
     */
    void delete(ClusterDocument document) throws DocumentStoreException;
}
