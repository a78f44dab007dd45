package io.clusterprovisioner.metrics;

import java.util.Map;

/**
 * Sink for point-in-time metric values keyed by topic and dimensions.
 */
public interface MetricsEmitter {

    void emitGauge(String topic, long value, Map<String, String> dimensions);

    void emitFloat(String topic, double value, Map<String, String> dimensions);
}
