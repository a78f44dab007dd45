package io.clusterprovisioner.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EtcdPathResolverTest {

    private EtcdPathResolver pathResolver;
    private final String testPrefix = "cluster-provisioner";

    @BeforeEach
    void setUp() {
        pathResolver = EtcdPathResolver.getInstance();
    }

    @Test
    void testSingletonPattern() {
        EtcdPathResolver instance1 = EtcdPathResolver.getInstance();
        EtcdPathResolver instance2 = EtcdPathResolver.getInstance();
        assertThat(instance1).isSameAs(instance2);
    }

    @Test
    void testGetRoot() {
        assertThat(pathResolver.getRoot(testPrefix)).isEqualTo("/cluster-provisioner");
    }

    @Test
    void testGetRootStripsSlashes() {
        assertThat(pathResolver.getRoot("/cluster-provisioner/")).isEqualTo("/cluster-provisioner");
    }

    @Test
    void testGetDocumentsPrefix() {
        assertThat(pathResolver.getDocumentsPrefix(testPrefix)).isEqualTo("/cluster-provisioner/cluster-documents");
    }

    @Test
    void testGetDocumentPath() {
        String path = pathResolver.getDocumentPath(testPrefix, "cluster-1");
        assertThat(path).isEqualTo("/cluster-provisioner/cluster-documents/cluster-1");
    }

    @Test
    void testResourceIdSlashesStayInOneSegment() {
        String key = "/subscriptions/s1/resourcegroups/rg/providers/clusters/dev";
        String path = pathResolver.getDocumentPath(testPrefix, key);

        assertThat(path).startsWith("/cluster-provisioner/cluster-documents/");
        assertThat(path.substring("/cluster-provisioner/cluster-documents/".length())).doesNotContain("/");
        assertThat(pathResolver.getKeyFromPath(testPrefix, path)).isEqualTo(key);
    }

    @Test
    void testKeyWithPercentRoundTrips() {
        String key = "/a%2Fb/c";
        assertThat(pathResolver.getKeyFromPath(testPrefix, pathResolver.getDocumentPath(testPrefix, key))).isEqualTo(key);
    }

    @Test
    void testGetKeyFromForeignPathRejected() {
        assertThatThrownBy(() -> pathResolver.getKeyFromPath(testPrefix, "/other/cluster-documents/x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBlankPrefixRejected() {
        assertThatThrownBy(() -> pathResolver.getRoot("/"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
