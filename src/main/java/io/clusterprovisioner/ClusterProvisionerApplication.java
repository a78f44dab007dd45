package io.clusterprovisioner;

import io.clusterprovisioner.backend.BuildInfo;
import io.clusterprovisioner.backend.CloudResourceClient;
import io.clusterprovisioner.backend.DefaultPipelineFactory;
import io.clusterprovisioner.backend.DryRunCloudResourceClient;
import io.clusterprovisioner.backend.PipelineFactory;
import io.clusterprovisioner.config.ProvisionerConfig;
import io.clusterprovisioner.diagnostics.ClusterInspectorFactory;
import io.clusterprovisioner.diagnostics.DryRunClusterInspectorFactory;
import io.clusterprovisioner.queue.LeaseQueue;
import io.clusterprovisioner.store.DocumentStore;
import io.clusterprovisioner.store.EtcdDocumentStore;
import io.clusterprovisioner.store.InMemoryDocumentStore;
import io.clusterprovisioner.util.ConflictRetrier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;

/**
 * Main Spring Boot application class for the cluster provisioner backend.
 * <p>
 * Each process runs a pool of workers that claim cluster documents from the
 * shared document store and drive them through their create, update or
 * delete pipeline. Processes coordinate only through conditional writes to
 * that store.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.clusterprovisioner")
public class ClusterProvisionerApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Provisioner backend");

        try {
            SpringApplication.run(ClusterProvisionerApplication.class, args);
            log.info("Cluster Provisioner backend started successfully");

        } catch (Exception e) {
            log.error("Failed to start Cluster Provisioner: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ProvisionerConfig config() {
        ProvisionerConfig config = new ProvisionerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * DocumentStore bean - etcd by default, in-process for local dry runs.
     */
    @Bean
    public DocumentStore documentStore(ProvisionerConfig config) {
        if (config.isMemoryStore()) {
            log.warn("Using in-memory document store; documents are lost on restart");
            return new InMemoryDocumentStore();
        }
        log.info("Initializing DocumentStore connection to etcd");
        return new EtcdDocumentStore(config.getEtcdEndpoints(), config.getEtcdKeyPrefix());
    }

    @Bean
    public LeaseQueue leaseQueue(DocumentStore documentStore, ProvisionerConfig config, Clock clock,
                                 @Value("${controller.id:}") String controllerId) {
        if (controllerId == null || controllerId.isBlank()) {
            throw new IllegalStateException("controller.id must be set (CONTROLLER_ID or HOSTNAME)");
        }
        return new LeaseQueue(documentStore, controllerId.trim(), Duration.ofSeconds(config.getLeaseTtlSeconds()),
            clock, new ConflictRetrier());
    }

    @Bean
    public BuildInfo buildInfo(@Value("${build.commit:unknown}") String commit) {
        log.info("Build commit: {}", commit);
        return new BuildInfo(commit);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineFactory pipelineFactory(ProvisionerConfig config) {
        return new DefaultPipelineFactory(
            Duration.ofSeconds(config.getConditionPollIntervalSeconds()),
            Duration.ofSeconds(config.getConditionTimeoutSeconds()));
    }

    /**
     * Fallback cloud client; a real implementation is supplied as its own bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public CloudResourceClient cloudResourceClient() {
        log.warn("No CloudResourceClient configured, using dry-run client");
        return new DryRunCloudResourceClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterInspectorFactory clusterInspectorFactory() {
        log.warn("No ClusterInspectorFactory configured, using dry-run inspector");
        return new DryRunClusterInspectorFactory();
    }
}
