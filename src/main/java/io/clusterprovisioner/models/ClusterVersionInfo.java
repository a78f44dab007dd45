package io.clusterprovisioner.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Version reported by a cluster's API server, plus an in-progress upgrade target if any.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterVersionInfo {

    @JsonProperty("version")
    private String version;

    @JsonProperty("desiredVersion")
    private String desiredVersion;

    @JsonProperty("progressing")
    private boolean progressing;
}
