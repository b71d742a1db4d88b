package com.elssolution.energymonitor.domain;

public enum DeviceStatus {
    ACTIVE,
    STANDBY,
    OFF;

    public static DeviceStatus of(double watts, double activeThresholdW, double standbyThresholdW) {
        if (watts >= activeThresholdW) return ACTIVE;
        if (watts >= standbyThresholdW) return STANDBY;
        return OFF;
    }
}
