package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall status category reported by the backend health check.
 */
public enum SystemStatus {
    OPERATIONAL("Operational"),
    WARNING("Warning"),
    CRITICAL("Critical"),
    UNKNOWN("Unknown");

    private final String label;

    SystemStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient mapping from the backend label. Anything unrecognised is UNKNOWN
     * so a new backend status never breaks decoding.
     */
    @JsonCreator
    public static SystemStatus fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (SystemStatus status : values()) {
            if (status.label.equalsIgnoreCase(label.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
