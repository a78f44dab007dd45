package io.clusterprovisioner.metrics;

/**
 * Constants for metric topics and tags used by the provisioner backend.
 */
public class MetricsConstants {
    public final static String INSTALL_TIME_METRIC_NAME = "backend.cluster.installtime";
    public final static String HOST_NAME_TAG = "hostname";

    private MetricsConstants() {}
}
