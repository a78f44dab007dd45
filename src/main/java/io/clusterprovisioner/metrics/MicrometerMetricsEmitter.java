package io.clusterprovisioner.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static io.clusterprovisioner.metrics.MetricsConstants.HOST_NAME_TAG;

/*
 * MetricsEmitter backed by Micrometer gauges. One gauge is registered per
 * topic and dimension set; later emissions overwrite its value.
 */
@Component
@Slf4j
public class MicrometerMetricsEmitter implements MetricsEmitter {

    private final MeterRegistry registry;
    private final String hostname;
    private final ConcurrentMap<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MicrometerMetricsEmitter(
        MeterRegistry registry,
        @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.hostname = controllerId;
        log.info("MicrometerMetricsEmitter initialized for the controller: {}", hostname);
    }

    @Override
    public void emitGauge(String topic, long value, Map<String, String> dimensions) {
        gauge(topic, dimensions).set(value);
        log.debug("Emitted gauge {}={} {}", topic, value, dimensions);
    }

    @Override
    public void emitFloat(String topic, double value, Map<String, String> dimensions) {
        gauge(topic, dimensions).set(value);
        log.debug("Emitted float {}={} {}", topic, value, dimensions);
    }

    /**
     * Create or retrieve the gauge value holder for a topic and dimension set.
     *
     * @param name the name of the gauge
     * @param dimensions a map of tag keys to tag values
     * @return the AtomicDouble backing the gauge
     */
    private AtomicDouble gauge(String name, Map<String, String> dimensions) {
        // sorted copy so the cache key does not depend on map iteration order
        Map<String, String> tags = dimensions != null ? new TreeMap<>(dimensions) : new TreeMap<>();
        return gauges.computeIfAbsent(name + tags, key -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including hostname.
     *
     * @param tags the map of tags
     * @return array of alternating keys and values
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
