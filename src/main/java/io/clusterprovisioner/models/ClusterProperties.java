package io.clusterprovisioner.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterprovisioner.enums.ProvisioningState;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster spec and status fields carried by {@link ManagedCluster}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterProperties {

    @JsonProperty("provisioningState")
    private ProvisioningState provisioningState;

    // state being processed when the last run failed
    @JsonProperty("failedProvisioningState")
    private ProvisioningState failedProvisioningState;

    @JsonProperty("lastError")
    private String lastError;

    @JsonProperty("provisionedBy")
    private String provisionedBy;

    @JsonProperty("kubernetesVersion")
    private String kubernetesVersion;

    @JsonProperty("workerCount")
    private int workerCount;

    public ClusterProperties(ProvisioningState provisioningState) {
        this.provisioningState = provisioningState;
    }
}
