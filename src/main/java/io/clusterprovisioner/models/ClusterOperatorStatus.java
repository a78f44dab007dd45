package io.clusterprovisioner.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterOperatorStatus {

    @JsonProperty("name")
    private String name;

    @JsonProperty("available")
    private boolean available;

    @JsonProperty("degraded")
    private boolean degraded;

    @JsonProperty("message")
    private String message;
}
