package io.clusterprovisioner.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterprovisioner.enums.ProvisioningState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Cluster document as persisted in the document store. Doubles as a work item:
 * the lease fields are set while a worker owns the document.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterDocument {

    @JsonProperty("id")
    private String id;

    // lower-cased id, unique in the store
    @JsonProperty("key")
    private String key;

    // overwritten from the store on every read
    @JsonProperty("concurrencyToken")
    private String concurrencyToken;

    @JsonProperty("leaseOwner")
    private String leaseOwner;

    @JsonProperty("leaseExpiry")
    private Instant leaseExpiry;

    @JsonProperty("dequeues")
    private int dequeues;

    @JsonProperty("retryAfter")
    private Instant retryAfter;

    @JsonProperty("cluster")
    private ManagedCluster cluster;

    public ClusterDocument(ManagedCluster cluster) {
        this.cluster = cluster;
        this.id = cluster.getId();
        this.key = normalizeKey(cluster.getId());
    }

    public static String normalizeKey(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resource id must not be blank");
        }
        return resourceId.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isLeaseLive(Instant now) {
        return leaseOwner != null && leaseExpiry != null && leaseExpiry.isAfter(now);
    }

    @JsonIgnore
    public boolean isLeasedBy(String owner, Instant now) {
        return isLeaseLive(now) && leaseOwner.equals(owner);
    }

    /**
     * Shortcut for the payload's provisioning state, null when the payload is missing.
     */
    public ProvisioningState provisioningState() {
        if (cluster == null || cluster.getProperties() == null) {
            return null;
        }
        return cluster.getProperties().getProvisioningState();
    }
}
