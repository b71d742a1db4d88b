package com.elssolution.energymonitor.domain;

/** Which {@code SensorSource} implementation backs a device. */
public enum SourceKind {
    HARDWARE,
    SIMULATED
}
