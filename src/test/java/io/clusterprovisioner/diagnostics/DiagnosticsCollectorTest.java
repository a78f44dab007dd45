package io.clusterprovisioner.diagnostics;

import ch.qos.logback.classic.Level;
import io.clusterprovisioner.models.ClusterOperatorStatus;
import io.clusterprovisioner.models.ClusterVersionInfo;
import io.clusterprovisioner.models.DiagnosticsSnapshot;
import io.clusterprovisioner.models.IngressControllerStatus;
import io.clusterprovisioner.models.NodeStatus;
import io.clusterprovisioner.testutil.LogCapture;
import io.clusterprovisioner.testutil.TestDocuments;
import io.clusterprovisioner.enums.ProvisioningState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiagnosticsCollectorTest {

    @Mock
    private ClusterInspector inspector;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testAllProbesSucceedLogsPrettyJsonInFixedOrder() throws Exception {
        when(inspector.getClusterVersion()).thenReturn(new ClusterVersionInfo("4.14.12", "4.14.12", false));
        when(inspector.listNodes()).thenReturn(List.of(new NodeStatus("master-0", NodeStatus.ROLE_MASTER, true)));
        when(inspector.listClusterOperators()).thenReturn(List.of(new ClusterOperatorStatus("dns", true, false, null)));
        when(inspector.listIngressControllers()).thenReturn(List.of(new IngressControllerStatus("default", "apps.example", true)));
        DiagnosticsCollector collector = new DiagnosticsCollector(inspector, executor, Duration.ofSeconds(5));

        DiagnosticsSnapshot snapshot;
        try (LogCapture logs = new LogCapture(DiagnosticsCollector.class)) {
            snapshot = collector.collect();

            List<String> messages = logs.messages(Level.INFO);
            assertThat(messages).hasSize(4);
            assertThat(messages.get(0)).startsWith("clusterVersion: {").contains("\"version\" : \"4.14.12\"");
            assertThat(messages.get(1)).startsWith("nodes: [").contains("master-0");
            assertThat(messages.get(2)).startsWith("clusterOperators: [").contains("dns");
            assertThat(messages.get(3)).startsWith("ingressControllers: [").contains("apps.example");
            assertThat(logs.messages(Level.ERROR)).isEmpty();
        }
        assertThat(snapshot.getClusterVersion().getVersion()).isEqualTo("4.14.12");
        assertThat(snapshot.getNodes()).hasSize(1);
        assertThat(snapshot.getFailures()).isEmpty();
    }

    @Test
    void testOneFailingProbeDoesNotMaskOthers() throws Exception {
        when(inspector.getClusterVersion()).thenReturn(new ClusterVersionInfo("4.14.12", null, true));
        when(inspector.listNodes()).thenThrow(new IOException("nodes is forbidden"));
        when(inspector.listClusterOperators()).thenReturn(List.of());
        when(inspector.listIngressControllers()).thenReturn(null);
        DiagnosticsCollector collector = new DiagnosticsCollector(inspector, executor, Duration.ofSeconds(5));

        DiagnosticsSnapshot snapshot;
        try (LogCapture logs = new LogCapture(DiagnosticsCollector.class)) {
            snapshot = collector.collect();

            List<String> info = logs.messages(Level.INFO);
            assertThat(info.get(0)).startsWith("clusterVersion: {");
            assertThat(info.subList(1, 4)).containsExactly("nodes: null", "clusterOperators: null", "ingressControllers: null");
            assertThat(logs.messages(Level.ERROR)).containsExactly("failed to collect nodes: nodes is forbidden");

            // error entry comes right before its null marker
            List<String> all = logs.messages();
            assertThat(all.indexOf("failed to collect nodes: nodes is forbidden") + 1)
                .isEqualTo(all.indexOf("nodes: null"));
        }
        assertThat(snapshot.getClusterVersion()).isNotNull();
        assertThat(snapshot.getNodes()).isNull();
        assertThat(snapshot.getFailures()).containsOnlyKeys("nodes");
    }

    @Test
    void testHangingProbeIsBoundedByTimeout() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(inspector.getClusterVersion()).thenAnswer(invocation -> {
            release.await(30, TimeUnit.SECONDS);
            return new ClusterVersionInfo("late", null, false);
        });
        when(inspector.listNodes()).thenReturn(List.of(new NodeStatus("worker-0", NodeStatus.ROLE_WORKER, false)));
        when(inspector.listClusterOperators()).thenReturn(List.of());
        when(inspector.listIngressControllers()).thenReturn(List.of());
        DiagnosticsCollector collector = new DiagnosticsCollector(inspector, executor, Duration.ofMillis(200));

        long startNanos = System.nanoTime();
        try (LogCapture logs = new LogCapture(DiagnosticsCollector.class)) {
            DiagnosticsSnapshot snapshot = collector.collect();

            assertThat(snapshot.getClusterVersion()).isNull();
            assertThat(snapshot.getNodes()).hasSize(1);
            assertThat(snapshot.getFailures().get("clusterVersion")).startsWith("timed out");
            assertThat(logs.messages(Level.INFO).get(0)).isEqualTo("clusterVersion: null");
        } finally {
            release.countDown();
        }
        assertThat(Duration.ofNanos(System.nanoTime() - startNanos)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void testHangingProbesShareOneDeadlineAndAreInterrupted() throws Exception {
        CountDownLatch neverReleased = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(4);
        Answer<Object> hang = invocation -> {
            try {
                neverReleased.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        };
        when(inspector.getClusterVersion()).thenAnswer(hang);
        when(inspector.listNodes()).thenAnswer(hang);
        when(inspector.listClusterOperators()).thenAnswer(hang);
        when(inspector.listIngressControllers()).thenAnswer(hang);
        DiagnosticsCollector collector = new DiagnosticsCollector(inspector, executor, Duration.ofMillis(500));

        long startNanos = System.nanoTime();
        DiagnosticsSnapshot snapshot = collector.collect();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        assertThat(snapshot.getFailures()).hasSize(4).allSatisfy((probe, reason) -> assertThat(reason).startsWith("timed out"));
        // four sequential waits would take at least 2s
        assertThat(elapsed).isLessThan(Duration.ofMillis(1500));
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void testRejectedExecutorStillLogsEveryProbe() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdownNow();
        DiagnosticsCollector collector = new DiagnosticsCollector(inspector, closed, Duration.ofSeconds(1));

        try (LogCapture logs = new LogCapture(DiagnosticsCollector.class)) {
            DiagnosticsSnapshot snapshot = collector.collect();

            assertThat(logs.messages(Level.INFO)).containsExactly(
                "clusterVersion: null", "nodes: null", "clusterOperators: null", "ingressControllers: null");
            assertThat(logs.messages(Level.ERROR)).hasSize(4);
            assertThat(snapshot.getFailures()).hasSize(4);
        }
    }

    @Test
    void testDryRunInspectorReportsRequestedSize() throws Exception {
        ClusterInspector dryRun = new DryRunClusterInspectorFactory()
            .forCluster(TestDocuments.cluster("/subscriptions/s1/clusters/dev", ProvisioningState.CREATING));

        assertThat(dryRun.getClusterVersion().getVersion()).isEqualTo("1.29.4");
        assertThat(dryRun.listNodes()).hasSize(DryRunClusterInspectorFactory.CONTROL_PLANE_NODES + 3)
            .allMatch(NodeStatus::isReady);
        assertThat(dryRun.listClusterOperators()).allMatch(ClusterOperatorStatus::isAvailable);
        assertThat(dryRun.listIngressControllers()).extracting(IngressControllerStatus::getName).containsExactly("default");
    }
}
