package com.elssolution.energymonitor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Either one device or the whole system. {@code deviceId == null} means whole-system.
 */
public record AnalysisScope(String deviceId) {

    private static final AnalysisScope SYSTEM = new AnalysisScope(null);

    public static AnalysisScope system() {
        return SYSTEM;
    }

    public static AnalysisScope device(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) throw new IllegalArgumentException("device id is required");
        return new AnalysisScope(deviceId);
    }

    public boolean isSystem() {
        return deviceId == null;
    }

    @JsonValue
    public String label() {
        return isSystem() ? "system" : "device:" + deviceId;
    }
}
