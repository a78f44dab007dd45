package io.clusterprovisioner.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle phase of a managed cluster document.
 *
 * <ul>
 *   <li><strong>Creating</strong>, <strong>Updating</strong>, <strong>Deleting</strong> - work pending for a worker</li>
 *   <li><strong>Succeeded</strong>, <strong>Failed</strong> - terminal, never dequeued</li>
 * </ul>
 */
public enum ProvisioningState {
    CREATING("Creating"),
    UPDATING("Updating"),
    DELETING("Deleting"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed");

    private final String value;

    ProvisioningState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    @JsonCreator
    public static ProvisioningState fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (ProvisioningState state : ProvisioningState.values()) {
            if (state.value.equalsIgnoreCase(trimmed) || state.name().equalsIgnoreCase(trimmed)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown provisioning state: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
