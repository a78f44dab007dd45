package io.clusterprovisioner.backend;

import io.clusterprovisioner.config.ProvisionerConfig;
import io.clusterprovisioner.diagnostics.DryRunClusterInspectorFactory;
import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.metrics.MetricsEmitter;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.queue.LeaseQueue;
import io.clusterprovisioner.steps.Steps;
import io.clusterprovisioner.store.InMemoryDocumentStore;
import io.clusterprovisioner.testutil.TestDocuments;
import io.clusterprovisioner.util.ConflictRetrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@ExtendWith(MockitoExtension.class)
class BackendTest {

    @Mock
    private CloudResourceClient cloud;

    @Mock
    private MetricsEmitter metrics;

    private InMemoryDocumentStore store;
    private LeaseQueue queue;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        queue = new LeaseQueue(store, "host-1", Duration.ofSeconds(60), Clock.systemUTC(), new ConflictRetrier());
    }

    @Test
    void testWorkersProcessAllDocuments() throws Exception {
        store.create(TestDocuments.document("/clusters/a", ProvisioningState.CREATING));
        store.create(TestDocuments.document("/clusters/b", ProvisioningState.UPDATING));
        store.create(TestDocuments.document("/clusters/c", ProvisioningState.DELETING));
        Backend backend = backend(new DefaultPipelineFactory(Duration.ofMillis(10), Duration.ofSeconds(5)), 5);

        backend.start();
        try {
            long deadline = System.currentTimeMillis() + 10_000;
            while (!allDone() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
        } finally {
            backend.shutdown();
        }

        assertThat(store.list())
            .extracting(ClusterDocument::getKey, ClusterDocument::provisioningState)
            .containsExactly(
                tuple("/clusters/a", ProvisioningState.SUCCEEDED),
                tuple("/clusters/b", ProvisioningState.SUCCEEDED));
        assertThat(backend.getWorkers()).hasSize(2).allMatch(Worker::isStopping);
    }

    @Test
    void testShutdownCancelsRunsThatOutliveTheTimeout() throws Exception {
        store.create(TestDocuments.document("/clusters/slow", ProvisioningState.CREATING));
        CountDownLatch started = new CountDownLatch(1);
        PipelineFactory pipelines = (state, manager) -> List.of(
            Steps.action("waitForever", ctx -> {
                started.countDown();
                ctx.sleep(Duration.ofMinutes(5));
            }));
        Backend backend = backend(pipelines, 0);

        backend.start();
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        backend.shutdown();

        ClusterDocument result = store.get("/clusters/slow");
        assertThat(result.provisioningState()).isEqualTo(ProvisioningState.CREATING);
        assertThat(result.getLeaseOwner()).isNull();
        assertThat(result.getCluster().getProperties().getLastError()).isNull();
    }

    @Test
    void testContextCarriesConfiguredSettings() {
        Backend backend = backend(new DefaultPipelineFactory(Duration.ofMillis(10), Duration.ofSeconds(5)), 5);
        try {
            BackendContext context = backend.getContext();
            assertThat(context.getPollInterval()).isEqualTo(Duration.ofMillis(20));
            assertThat(context.getMaxDequeueCount()).isEqualTo(3);
            assertThat(context.getRetryBackoff()).isEqualTo(Duration.ofSeconds(7));
            assertThat(context.getLeaseRenewInterval()).isEqualTo(Duration.ofSeconds(10));
        } finally {
            backend.shutdown();
        }
    }

    private boolean allDone() throws Exception {
        List<ClusterDocument> documents = store.list();
        return documents.size() == 2 && documents.stream()
            .allMatch(document -> document.provisioningState() == ProvisioningState.SUCCEEDED
                && document.getLeaseOwner() == null);
    }

    private Backend backend(PipelineFactory pipelines, long shutdownTimeoutSeconds) {
        ProvisionerConfig.Worker worker = new ProvisionerConfig.Worker();
        worker.setCount(2);
        worker.setPollIntervalMillis(20L);
        worker.setMaxDequeueCount(3);
        worker.setRetryBackoffSeconds(7L);
        worker.setShutdownTimeoutSeconds(shutdownTimeoutSeconds);
        ProvisionerConfig.Store storeConfig = new ProvisionerConfig.Store();
        storeConfig.setBackend("memory");
        ProvisionerConfig.ConfigModel model = new ProvisionerConfig.ConfigModel();
        model.setWorker(worker);
        model.setStore(storeConfig);

        return new Backend(queue, pipelines, cloud, new DryRunClusterInspectorFactory(), metrics,
            new BuildInfo("abc123"), Clock.systemUTC(), new ProvisionerConfig(model));
    }
}
