package io.clusterprovisioner.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterDocumentTest {

    private final ObjectMapper objectMapper = JsonUtils.newObjectMapper();

    @Test
    void testConstructorDerivesKeyFromId() {
        ManagedCluster cluster = new ManagedCluster("/Subscriptions/S1/Clusters/Dev", "Dev", "eastus",
            new ClusterProperties(ProvisioningState.CREATING));

        ClusterDocument document = new ClusterDocument(cluster);

        assertThat(document.getId()).isEqualTo("/Subscriptions/S1/Clusters/Dev");
        assertThat(document.getKey()).isEqualTo("/subscriptions/s1/clusters/dev");
        assertThat(document.provisioningState()).isEqualTo(ProvisioningState.CREATING);
    }

    @Test
    void testNormalizeKeyRejectsBlank() {
        assertThatThrownBy(() -> ClusterDocument.normalizeKey("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterDocument.normalizeKey(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testLeaseLiveness() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        ClusterDocument document = new ClusterDocument();
        assertThat(document.isLeaseLive(now)).isFalse();

        document.setLeaseOwner("worker-a");
        document.setLeaseExpiry(now.plusSeconds(1));
        assertThat(document.isLeaseLive(now)).isTrue();
        assertThat(document.isLeasedBy("worker-a", now)).isTrue();
        assertThat(document.isLeasedBy("worker-b", now)).isFalse();

        assertThat(document.isLeaseLive(now.plusSeconds(1))).isFalse();
    }

    @Test
    void testJsonShape() throws Exception {
        ClusterProperties properties = new ClusterProperties(ProvisioningState.FAILED);
        properties.setFailedProvisioningState(ProvisioningState.UPDATING);
        properties.setLastError("quota exceeded");
        ClusterDocument document = new ClusterDocument(new ManagedCluster("/clusters/dev", "dev", "eastus", properties));
        document.setLeaseOwner("worker-a");
        document.setLeaseExpiry(Instant.parse("2024-05-01T12:01:00Z"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(document));

        assertThat(json.get("leaseExpiry").asText()).isEqualTo("2024-05-01T12:01:00Z");
        assertThat(json.has("retryAfter")).isFalse();
        assertThat(json.has("leaseLive")).isFalse();
        JsonNode props = json.get("cluster").get("properties");
        assertThat(props.get("provisioningState").asText()).isEqualTo("Failed");
        assertThat(props.get("failedProvisioningState").asText()).isEqualTo("Updating");
        assertThat(props.get("lastError").asText()).isEqualTo("quota exceeded");
    }

    @Test
    void testReadIgnoresUnknownFields() throws Exception {
        String json = "{\"id\":\"/clusters/dev\",\"key\":\"/clusters/dev\",\"dequeues\":2,\"futureField\":true,"
            + "\"cluster\":{\"id\":\"/clusters/dev\",\"properties\":{\"provisioningState\":\"Deleting\",\"extra\":1}}}";

        ClusterDocument document = objectMapper.readValue(json, ClusterDocument.class);

        assertThat(document.getDequeues()).isEqualTo(2);
        assertThat(document.provisioningState()).isEqualTo(ProvisioningState.DELETING);
    }
}
