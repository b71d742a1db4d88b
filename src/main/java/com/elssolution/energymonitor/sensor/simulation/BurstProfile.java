package com.elssolution.energymonitor.sensor.simulation;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Short high-power bursts (microwave). The day is cut into {@code slot}-long slots and each slot
 * is "on" with {@code probability}, decided from the device seed so traces repeat.
 */
public record BurstProfile(double burstWatts, double standbyWatts, Duration slot, double probability, double jitter)
        implements ApplianceProfile {

    @Override
    public double baseWatts(ZonedDateTime t, long seed) {
        long slotNo = Math.floorDiv(t.toInstant().toEpochMilli(), slot.toMillis());
        return ApplianceProfile.unit(seed, slotNo) < probability ? burstWatts : standbyWatts;
    }
}
