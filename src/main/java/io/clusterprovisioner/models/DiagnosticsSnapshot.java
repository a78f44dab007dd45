package io.clusterprovisioner.models;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort view of a cluster's health taken after a step failed.
 * Any resource may be null; {@code failures} maps probe name to the reason it failed.
 */
@Data
public class DiagnosticsSnapshot {

    private ClusterVersionInfo clusterVersion;
    private List<NodeStatus> nodes;
    private List<ClusterOperatorStatus> clusterOperators;
    private List<IngressControllerStatus> ingressControllers;
    private Map<String, String> failures = new LinkedHashMap<>();
}
