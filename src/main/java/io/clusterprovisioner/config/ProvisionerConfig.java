package io.clusterprovisioner.config;

import io.clusterprovisioner.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import static io.clusterprovisioner.config.Constants.*;

/**
 * Configuration for the provisioner backend.
 * Loads configuration from application.yml with fallbacks to constants.
 * An external file named by PROVISIONER_CONFIG_FILE takes precedence over the classpath copy.
 */
@Slf4j
@Getter
public class ProvisionerConfig {

    private final String[] etcdEndpoints;
    private final String etcdKeyPrefix;
    private final String storeBackend;
    private final int workerCount;
    private final long pollIntervalMillis;
    private final long leaseTtlSeconds;
    private final long leaseRenewIntervalSeconds;
    private final int maxDequeueCount;
    private final long retryBackoffSeconds;
    private final long shutdownTimeoutSeconds;
    private final long conditionPollIntervalSeconds;
    private final long conditionTimeoutSeconds;
    private final long probeTimeoutSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public ProvisionerConfig() {
        this(loadYamlConfig());
    }

    public ProvisionerConfig(ConfigModel config) {
        ConfigModel model = config != null ? config : new ConfigModel();
        Etcd etcd = model.getEtcd() != null ? model.getEtcd() : new Etcd();
        Worker worker = model.getWorker() != null ? model.getWorker() : new Worker();
        Pipeline pipeline = model.getPipeline() != null ? model.getPipeline() : new Pipeline();
        Diagnostics diagnostics = model.getDiagnostics() != null ? model.getDiagnostics() : new Diagnostics();

        this.etcdEndpoints = parseEndpoints(etcd);
        this.etcdKeyPrefix = orDefault(etcd.getKeyPrefix(), DEFAULT_KEY_PREFIX);
        this.storeBackend = parseStoreBackend(model.getStore());
        this.workerCount = orDefault(worker.getCount(), DEFAULT_WORKER_COUNT);
        this.pollIntervalMillis = orDefault(worker.getPollIntervalMillis(), DEFAULT_POLL_INTERVAL_MILLIS);
        this.leaseTtlSeconds = orDefault(worker.getLeaseTtlSeconds(), DEFAULT_LEASE_TTL_SECONDS);
        this.leaseRenewIntervalSeconds = orDefault(worker.getLeaseRenewIntervalSeconds(), DEFAULT_LEASE_RENEW_INTERVAL_SECONDS);
        this.maxDequeueCount = orDefault(worker.getMaxDequeueCount(), DEFAULT_MAX_DEQUEUE_COUNT);
        this.retryBackoffSeconds = orDefault(worker.getRetryBackoffSeconds(), DEFAULT_RETRY_BACKOFF_SECONDS);
        this.shutdownTimeoutSeconds = orDefault(worker.getShutdownTimeoutSeconds(), DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
        this.conditionPollIntervalSeconds = orDefault(pipeline.getConditionPollIntervalSeconds(), DEFAULT_CONDITION_POLL_INTERVAL_SECONDS);
        this.conditionTimeoutSeconds = orDefault(pipeline.getConditionTimeoutSeconds(), DEFAULT_CONDITION_TIMEOUT_SECONDS);
        this.probeTimeoutSeconds = orDefault(diagnostics.getProbeTimeoutSeconds(), DEFAULT_PROBE_TIMEOUT_SECONDS);

        validate();

        log.info("Loaded provisioner config - store: {}, etcd endpoints: {}, prefix: {}, workers: {}, lease ttl: {}s",
                storeBackend, String.join(", ", etcdEndpoints), etcdKeyPrefix, workerCount, leaseTtlSeconds);
    }

    /**
     * Reject settings the backend cannot run with.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        if (workerCount < 1) {
            throw new IllegalStateException("worker.count must be at least 1, got " + workerCount);
        }
        if (pollIntervalMillis <= 0) {
            throw new IllegalStateException("worker.pollIntervalMillis must be positive, got " + pollIntervalMillis);
        }
        if (leaseTtlSeconds <= 0 || leaseRenewIntervalSeconds <= 0) {
            throw new IllegalStateException("worker lease ttl and renew interval must be positive");
        }
        // a lease must be renewed before it can expire
        if (leaseRenewIntervalSeconds >= leaseTtlSeconds) {
            throw new IllegalStateException("worker.leaseRenewIntervalSeconds (" + leaseRenewIntervalSeconds
                    + ") must be less than worker.leaseTtlSeconds (" + leaseTtlSeconds + ")");
        }
        if (maxDequeueCount < 1) {
            throw new IllegalStateException("worker.maxDequeueCount must be at least 1, got " + maxDequeueCount);
        }
        if (retryBackoffSeconds < 0 || shutdownTimeoutSeconds < 0) {
            throw new IllegalStateException("worker retry backoff and shutdown timeout must not be negative");
        }
        if (conditionPollIntervalSeconds <= 0 || conditionTimeoutSeconds <= 0) {
            throw new IllegalStateException("pipeline condition poll interval and timeout must be positive");
        }
        if (probeTimeoutSeconds <= 0) {
            throw new IllegalStateException("diagnostics.probeTimeoutSeconds must be positive, got " + probeTimeoutSeconds);
        }
    }

    public boolean isMemoryStore() {
        return STORE_BACKEND_MEMORY.equals(storeBackend);
    }

    private static ConfigModel loadYamlConfig() {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = EnvironmentUtils.getEnv(ENV_CONFIG_FILE, null);
        if (externalConfigPath != null) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", ENV_CONFIG_FILE);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = ProvisionerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration from " + loadedFrom, e);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to parse configuration from " + loadedFrom + ": " + e.getMessage(), e);
        }
    }

    private static String[] parseEndpoints(Etcd etcd) {
        List<String> endpoints = etcd.getEndpoints();
        if (endpoints != null && !endpoints.isEmpty()) {
            return endpoints.toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static String parseStoreBackend(Store store) {
        String backend = store != null ? store.getBackend() : null;
        if (backend == null || backend.isBlank()) {
            return DEFAULT_STORE_BACKEND;
        }
        String normalized = backend.trim().toLowerCase(Locale.ROOT);
        if (!STORE_BACKEND_ETCD.equals(normalized) && !STORE_BACKEND_MEMORY.equals(normalized)) {
            throw new IllegalStateException("Unknown store.backend '" + backend + "', expected "
                    + STORE_BACKEND_ETCD + " or " + STORE_BACKEND_MEMORY);
        }
        return normalized;
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static int orDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static long orDefault(Long value, long defaultValue) {
        return value != null ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Store store;
        private Worker worker;
        private Pipeline pipeline;
        private Diagnostics diagnostics;
        private Controller controller; // resolved by Spring @Value
        private Build build; // resolved by Spring @Value
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
        private String keyPrefix;
    }

    @Data
    public static class Store {
        private String backend;
    }

    @Data
    public static class Worker {
        private Integer count;
        private Long pollIntervalMillis;
        private Long leaseTtlSeconds;
        private Long leaseRenewIntervalSeconds;
        private Integer maxDequeueCount;
        private Long retryBackoffSeconds;
        private Long shutdownTimeoutSeconds;
    }

    @Data
    public static class Pipeline {
        private Long conditionPollIntervalSeconds;
        private Long conditionTimeoutSeconds;
    }

    @Data
    public static class Diagnostics {
        private Long probeTimeoutSeconds;
    }

    @Data
    public static class Controller {
        private String id;
    }

    @Data
    public static class Build {
        private String commit;
    }
}
