package io.clusterprovisioner.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-process DocumentStore with the same compare-and-swap semantics as the
 * etcd store. Tokens come from a store-wide revision counter, so a token is
 * never reused for a key even after delete and re-create.
 * Documents are held as JSON so callers never share mutable state with the store.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final ObjectMapper objectMapper = JsonUtils.newObjectMapper();
    private final Map<String, StoredDocument> documents = new TreeMap<>();
    private long revision = 0;

    public InMemoryDocumentStore() {
        log.info("InMemoryDocumentStore initialized");
    }

    @Override
    public synchronized ClusterDocument create(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey() != null ? document.getKey() : document.getId());
        if (documents.containsKey(key)) {
            throw new ConcurrencyConflictException("Document " + key + " already exists");
        }
        document.setKey(key);
        return put(key, document);
    }

    @Override
    public synchronized ClusterDocument get(String key) throws DocumentStoreException {
        String normalized = ClusterDocument.normalizeKey(key);
        StoredDocument stored = documents.get(normalized);
        if (stored == null) {
            throw new DocumentNotFoundException("Document " + normalized + " not found");
        }
        return stored.toDocument(objectMapper);
    }

    @Override
    public synchronized List<ClusterDocument> list() throws DocumentStoreException {
        List<ClusterDocument> result = new ArrayList<>(documents.size());
        for (StoredDocument stored : documents.values()) {
            result.add(stored.toDocument(objectMapper));
        }
        return result;
    }

    @Override
    public synchronized ClusterDocument write(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey());
        checkToken(key, document.getConcurrencyToken());
        return put(key, document);
    }

    @Override
    public synchronized void delete(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey());
        checkToken(key, document.getConcurrencyToken());
        documents.remove(key);
        log.debug("Deleted document {}", key);
    }

    private void checkToken(String key, String token) throws DocumentStoreException {
        StoredDocument stored = documents.get(key);
        if (stored == null) {
            throw new DocumentNotFoundException("Document " + key + " not found");
        }
        if (token == null || !token.equals(Long.toString(stored.revision))) {
            throw new ConcurrencyConflictException(
                "Document " + key + " was modified concurrently (expected revision " + token + ", found " + stored.revision + ")");
        }
    }

    private ClusterDocument put(String key, ClusterDocument document) throws DocumentStoreException {
        long next = revision + 1;
        String previousToken = document.getConcurrencyToken();
        document.setConcurrencyToken(null);
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            document.setConcurrencyToken(previousToken);
            throw new DocumentStoreException("Failed to serialize document " + key, e);
        }
        revision = next;
        documents.put(key, new StoredDocument(json, next));
        document.setConcurrencyToken(Long.toString(next));
        log.debug("Stored document {} at revision {}", key, next);
        return document;
    }

    private static final class StoredDocument {
        private final String json;
        private final long revision;

        private StoredDocument(String json, long revision) {
            this.json = json;
            this.revision = revision;
        }

        private ClusterDocument toDocument(ObjectMapper objectMapper) throws DocumentStoreException {
            try {
                ClusterDocument document = objectMapper.readValue(json, ClusterDocument.class);
                document.setConcurrencyToken(Long.toString(revision));
                return document;
            } catch (JsonProcessingException e) {
                throw new DocumentStoreException("Failed to parse stored document", e);
            }
        }
    }
}
