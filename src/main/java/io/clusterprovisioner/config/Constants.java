package io.clusterprovisioner.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_KEY_PREFIX = "cluster-provisioner";
    public static final String DEFAULT_STORE_BACKEND = "etcd";

    // Store backends
    public static final String STORE_BACKEND_ETCD = "etcd";
    public static final String STORE_BACKEND_MEMORY = "memory";

    // Worker defaults
    public static final int DEFAULT_WORKER_COUNT = 2;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 1000L;
    public static final long DEFAULT_LEASE_TTL_SECONDS = 60L;
    public static final long DEFAULT_LEASE_RENEW_INTERVAL_SECONDS = 10L;
    public static final int DEFAULT_MAX_DEQUEUE_COUNT = 5;
    public static final long DEFAULT_RETRY_BACKOFF_SECONDS = 30L;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 60L;

    // Pipeline defaults
    public static final long DEFAULT_CONDITION_POLL_INTERVAL_SECONDS = 10L;
    public static final long DEFAULT_CONDITION_TIMEOUT_SECONDS = 1800L;

    // Diagnostics defaults
    public static final long DEFAULT_PROBE_TIMEOUT_SECONDS = 30L;

    // Conflict retry policy for read-modify-write cycles
    public static final int CONFLICT_RETRY_MAX_ATTEMPTS = 5;
    public static final long CONFLICT_RETRY_BACKOFF_MILLIS = 10L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_CLUSTER_DOCUMENTS = "cluster-documents";

    // Environment variables
    public static final String ENV_CONFIG_FILE = "PROVISIONER_CONFIG_FILE";
}
