package io.clusterprovisioner.store;

import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.testutil.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDocumentStoreTest {

    private static final String ID = "/Subscriptions/S1/Clusters/Dev";

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    @Test
    void testCreateNormalizesKeyAndAssignsToken() throws Exception {
        ClusterDocument created = store.create(TestDocuments.document(ID, ProvisioningState.CREATING));

        assertThat(created.getKey()).isEqualTo("/subscriptions/s1/clusters/dev");
        assertThat(created.getId()).isEqualTo(ID);
        assertThat(created.getConcurrencyToken()).isNotBlank();
    }

    @Test
    void testGetIsCaseInsensitive() throws Exception {
        store.create(TestDocuments.document(ID, ProvisioningState.CREATING));

        ClusterDocument read = store.get(ID.toUpperCase());

        assertThat(read.getCluster().getProperties().getProvisioningState()).isEqualTo(ProvisioningState.CREATING);
    }

    @Test
    void testCreateDuplicateConflicts() throws Exception {
        store.create(TestDocuments.document(ID, ProvisioningState.CREATING));

        assertThatThrownBy(() -> store.create(TestDocuments.document(ID.toLowerCase(), ProvisioningState.CREATING)))
            .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void testGetMissingThrowsNotFound() {
        assertThatThrownBy(() -> store.get("/nope")).isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void testWriteWithStaleTokenConflicts() throws Exception {
        store.create(TestDocuments.document(ID, ProvisioningState.CREATING));
        ClusterDocument first = store.get(ID);
        ClusterDocument second = store.get(ID);

        first.setDequeues(1);
        ClusterDocument written = store.write(first);
        assertThat(written.getConcurrencyToken()).isNotEqualTo(second.getConcurrencyToken());

        second.setDequeues(7);
        assertThatThrownBy(() -> store.write(second)).isInstanceOf(ConcurrencyConflictException.class);
        assertThat(store.get(ID).getDequeues()).isEqualTo(1);
    }

    @Test
    void testWriteAfterDeleteIsNotFound() throws Exception {
        ClusterDocument created = store.create(TestDocuments.document(ID, ProvisioningState.DELETING));
        ClusterDocument stale = store.get(ID);

        store.delete(created);

        assertThatThrownBy(() -> store.write(stale)).isInstanceOf(DocumentNotFoundException.class);
        assertThat(store.list()).isEmpty();
    }

    @Test
    void testDeleteWithStaleTokenConflicts() throws Exception {
        ClusterDocument created = store.create(TestDocuments.document(ID, ProvisioningState.CREATING));
        ClusterDocument current = store.get(ID);
        store.write(current);

        assertThatThrownBy(() -> store.delete(created)).isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void testReadsAreIsolatedCopies() throws Exception {
        store.create(TestDocuments.document(ID, ProvisioningState.CREATING));
        ClusterDocument read = store.get(ID);

        read.getCluster().getProperties().setLastError("local change");

        assertThat(store.get(ID).getCluster().getProperties().getLastError()).isNull();
    }

    @Test
    void testTokenNeverReusedAfterRecreate() throws Exception {
        ClusterDocument first = store.create(TestDocuments.document(ID, ProvisioningState.CREATING));
        String firstToken = first.getConcurrencyToken();
        store.delete(first);

        ClusterDocument again = store.create(TestDocuments.document(ID, ProvisioningState.CREATING));

        assertThat(again.getConcurrencyToken()).isNotEqualTo(firstToken);
    }

    @Test
    void testListReturnsAllDocuments() throws Exception {
        store.create(TestDocuments.document("/clusters/a", ProvisioningState.CREATING));
        store.create(TestDocuments.document("/clusters/b", ProvisioningState.SUCCEEDED));

        assertThat(store.list()).extracting(ClusterDocument::getKey).containsExactly("/clusters/a", "/clusters/b");
    }
}
