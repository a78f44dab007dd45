package io.clusterprovisioner.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.util.JsonUtils;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of DocumentStore.
 * The concurrency token of a document is the mod_revision of its key; every
 * write is an etcd transaction guarded by that revision.
 */
@Slf4j
public class EtcdDocumentStore implements DocumentStore, AutoCloseable {

    // TODO: Make etcd timeout configurable once the config model has an etcd timeout entry
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    private static final String TOKEN_FIELD = "concurrencyToken";

    private final Client etcdClient;
    private final KV kvClient;
    private final String keyPrefix;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdDocumentStore(String[] etcdEndpoints, String keyPrefix) {
        this(Client.builder().endpoints(etcdEndpoints).build(), keyPrefix);
        log.info("EtcdDocumentStore initialized with endpoints: {} and prefix: {}",
            String.join(",", etcdEndpoints), keyPrefix);
    }

    private EtcdDocumentStore(Client etcdClient, String keyPrefix) {
        this(etcdClient, etcdClient.getKVClient(), keyPrefix);
    }

    /**
     * Test constructor with injected dependencies
     */
    EtcdDocumentStore(Client etcdClient, KV kvClient, String keyPrefix) {
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.keyPrefix = keyPrefix;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = JsonUtils.newObjectMapper();
    }

    // =================================================================
    // DOCUMENT OPERATIONS
    // =================================================================

    @Override
    public ClusterDocument create(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey() != null ? document.getKey() : document.getId());
        document.setKey(key);
        ByteSequence keyBytes = toBytes(pathResolver.getDocumentPath(keyPrefix, key));
        ByteSequence valueBytes = serialize(document);

        // version == 0 means the key has never been written (or was deleted)
        TxnResponse txnResponse = await(kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0)))
            .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
            .commit(), "create " + key);

        if (!txnResponse.isSucceeded()) {
            throw new ConcurrencyConflictException("Document " + key + " already exists");
        }

        document.setConcurrencyToken(Long.toString(txnResponse.getHeader().getRevision()));
        log.debug("Created document {} at revision {}", key, document.getConcurrencyToken());
        return document;
    }

    @Override
    public ClusterDocument get(String key) throws DocumentStoreException {
        String normalized = ClusterDocument.normalizeKey(key);
        ByteSequence keyBytes = toBytes(pathResolver.getDocumentPath(keyPrefix, normalized));
        GetResponse response = await(kvClient.get(keyBytes), "get " + normalized);

        if (response.getKvs().isEmpty()) {
            throw new DocumentNotFoundException("Document " + normalized + " not found");
        }
        return deserialize(response.getKvs().get(0));
    }

    @Override
    public List<ClusterDocument> list() throws DocumentStoreException {
        ByteSequence prefixBytes = toBytes(pathResolver.getDocumentsPrefix(keyPrefix) + "/");
        GetOption getOption = GetOption.newBuilder()
            .withPrefix(prefixBytes)
            .build();
        GetResponse response = await(kvClient.get(prefixBytes, getOption), "list documents");

        List<ClusterDocument> documents = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            documents.add(deserialize(kv));
        }
        log.debug("Listed {} documents", documents.size());
        return documents;
    }

    @Override
    public ClusterDocument write(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey());
        long revision = parseToken(document);
        ByteSequence keyBytes = toBytes(pathResolver.getDocumentPath(keyPrefix, key));
        ByteSequence valueBytes = serialize(document);

        TxnResponse txnResponse = await(kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(revision)))
            .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
            .Else(Op.get(keyBytes, GetOption.DEFAULT))
            .commit(), "write " + key);

        if (!txnResponse.isSucceeded()) {
            throw failedPrecondition(txnResponse, key, revision);
        }

        document.setConcurrencyToken(Long.toString(txnResponse.getHeader().getRevision()));
        log.debug("Wrote document {} using CAS, new revision {}", key, document.getConcurrencyToken());
        return document;
    }

    @Override
    public void delete(ClusterDocument document) throws DocumentStoreException {
        String key = ClusterDocument.normalizeKey(document.getKey());
        long revision = parseToken(document);
        ByteSequence keyBytes = toBytes(pathResolver.getDocumentPath(keyPrefix, key));

        TxnResponse txnResponse = await(kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(revision)))
            .Then(Op.delete(keyBytes, DeleteOption.DEFAULT))
            .Else(Op.get(keyBytes, GetOption.DEFAULT))
            .commit(), "delete " + key);

        if (!txnResponse.isSucceeded()) {
            throw failedPrecondition(txnResponse, key, revision);
        }
        log.debug("Deleted document {} at revision {}", key, revision);
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private DocumentStoreException failedPrecondition(TxnResponse txnResponse, String key, long revision) {
        boolean missing = txnResponse.getGetResponses().isEmpty()
            || txnResponse.getGetResponses().get(0).getKvs().isEmpty();
        if (missing) {
            return new DocumentNotFoundException("Document " + key + " not found");
        }
        long current = txnResponse.getGetResponses().get(0).getKvs().get(0).getModRevision();
        return new ConcurrencyConflictException(
            "Document " + key + " was modified concurrently (expected revision " + revision + ", found " + current + ")");
    }

    private long parseToken(ClusterDocument document) throws DocumentStoreException {
        String token = document.getConcurrencyToken();
        if (token == null || token.isBlank()) {
            throw new DocumentStoreException("Document " + document.getKey() + " has no concurrency token");
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new DocumentStoreException("Invalid concurrency token '" + token + "' for document " + document.getKey(), e);
        }
    }

    private ByteSequence serialize(ClusterDocument document) throws DocumentStoreException {
        try {
            ObjectNode node = objectMapper.valueToTree(document);
            // the token lives in etcd metadata, never in the value
            node.remove(TOKEN_FIELD);
            return toBytes(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DocumentStoreException("Failed to serialize document " + document.getKey(), e);
        }
    }

    private ClusterDocument deserialize(KeyValue kv) throws DocumentStoreException {
        String path = kv.getKey().toString(UTF_8);
        try {
            ClusterDocument document = objectMapper.readValue(kv.getValue().toString(UTF_8), ClusterDocument.class);
            if (document.getKey() == null) {
                document.setKey(pathResolver.getKeyFromPath(keyPrefix, path));
            }
            document.setConcurrencyToken(Long.toString(kv.getModRevision()));
            return document;
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException("Failed to parse document at " + path, e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String operation) throws DocumentStoreException {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted during etcd " + operation, e);
        } catch (ExecutionException e) {
            throw new DocumentStoreException("etcd " + operation + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new DocumentStoreException("Timeout during etcd " + operation, e);
        }
    }

    private static ByteSequence toBytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }

    @Override
    public void close() {
        if (etcdClient != null) {
            log.info("Closing etcd client");
            etcdClient.close();
        }
    }
}
