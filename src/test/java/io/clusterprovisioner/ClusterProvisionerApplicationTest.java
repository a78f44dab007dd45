package io.clusterprovisioner;

import io.clusterprovisioner.config.ProvisionerConfig;
import io.clusterprovisioner.queue.LeaseQueue;
import io.clusterprovisioner.store.DocumentStore;
import io.clusterprovisioner.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterProvisionerApplicationTest {

    private final ClusterProvisionerApplication application = new ClusterProvisionerApplication();

    @Test
    void testMemoryBackendSelectsInMemoryStore() {
        DocumentStore store = application.documentStore(memoryConfig());

        assertThat(store).isInstanceOf(InMemoryDocumentStore.class);
    }

    @Test
    void testLeaseQueueUsesControllerIdAndTtl() {
        ProvisionerConfig config = memoryConfig();

        LeaseQueue queue = application.leaseQueue(new InMemoryDocumentStore(), config, Clock.systemUTC(), " host-1 ");

        assertThat(queue.getOwner()).isEqualTo("host-1");
        assertThat(queue.getLeaseTtl()).isEqualTo(Duration.ofSeconds(config.getLeaseTtlSeconds()));
    }

    @Test
    void testBlankControllerIdRejected() {
        assertThatThrownBy(() -> application.leaseQueue(new InMemoryDocumentStore(), memoryConfig(), Clock.systemUTC(), ""))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("controller.id");
    }

    @Test
    void testFallbackCollaborators() {
        assertThat(application.cloudResourceClient()).isNotNull();
        assertThat(application.clusterInspectorFactory()).isNotNull();
        assertThat(application.pipelineFactory(memoryConfig())).isNotNull();
        assertThat(application.buildInfo("abc123").getCommit()).isEqualTo("abc123");
    }

    private static ProvisionerConfig memoryConfig() {
        ProvisionerConfig.Store store = new ProvisionerConfig.Store();
        store.setBackend("memory");
        ProvisionerConfig.ConfigModel model = new ProvisionerConfig.ConfigModel();
        model.setStore(store);
        return new ProvisionerConfig(model);
    }
}
