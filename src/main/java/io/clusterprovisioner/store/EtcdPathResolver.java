package io.clusterprovisioner.store;

import java.nio.file.Paths;

import static io.clusterprovisioner.config.Constants.PATH_CLUSTER_DOCUMENTS;
import static io.clusterprovisioner.config.Constants.PATH_DELIMITER;

/**
 * Centralized etcd path resolver for cluster documents.
 * Stateless singleton; the key prefix is passed in on every call.
 */
public class EtcdPathResolver {

    // Singleton instance - stateless
    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // ROOT PATHS
    // =================================================================

    /**
     * Get root path for a deployment prefix
     * Pattern: /<prefix>
     */
    public String getRoot(String prefix) {
        return Paths.get(PATH_DELIMITER, stripSlashes(prefix)).toString();
    }

    // =================================================================
    // CLUSTER DOCUMENT PATHS
    // =================================================================

    /**
     * Get prefix for all cluster documents
     * Pattern: /<prefix>/cluster-documents
     */
    public String getDocumentsPrefix(String prefix) {
        return Paths.get(getRoot(prefix), PATH_CLUSTER_DOCUMENTS).toString();
    }

    /**
     * Get path of one cluster document
     * Pattern: /<prefix>/cluster-documents/<key>
     */
    public String getDocumentPath(String prefix, String key) {
        return getDocumentsPrefix(prefix) + PATH_DELIMITER + encodeKey(key);
    }

    /**
     * Recover the document key from a full document path.
     */
    public String getKeyFromPath(String prefix, String path) {
        String documentsPrefix = getDocumentsPrefix(prefix) + PATH_DELIMITER;
        if (path == null || !path.startsWith(documentsPrefix)) {
            throw new IllegalArgumentException("Path " + path + " is not under " + documentsPrefix);
        }
        return decodeKey(path.substring(documentsPrefix.length()));
    }

    // resource ids contain '/', which would otherwise nest keys
    private static String encodeKey(String key) {
        return key.replace("%", "%25").replace("/", "%2F");
    }

    private static String decodeKey(String encoded) {
        return encoded.replace("%2F", "/").replace("%25", "%");
    }

    private static String stripSlashes(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("etcd key prefix must not be blank");
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith(PATH_DELIMITER)) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(PATH_DELIMITER)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("etcd key prefix must not be blank");
        }
        return trimmed;
    }
}
