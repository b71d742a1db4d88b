package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One successful poll of one device. Immutable once built.
 * {@code energyWh} and {@code cost} are increments since the previous stored reading of the same device.
 */
@Value
@Builder
@Jacksonized
public class Reading {
    String deviceId;
    Instant timestamp;
    double rawValue;
    double powerW;
    double energyWh;
    double cost;
}
