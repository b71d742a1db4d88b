package com.elssolution.energymonitor.sensor.simulation;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Compressor-style load: {@code onWatts} for the first {@code onTime} of every {@code cycle},
 * {@code standbyWatts} for the rest. Cycles are aligned to the epoch.
 */
public record CyclicProfile(double onWatts, double standbyWatts, Duration cycle, Duration onTime, double jitter)
        implements ApplianceProfile {

    public CyclicProfile {
        if (cycle.isZero() || cycle.isNegative()) throw new IllegalArgumentException("cycle must be positive");
        if (onTime.compareTo(cycle) > 0) throw new IllegalArgumentException("on time longer than cycle");
    }

    @Override
    public double baseWatts(ZonedDateTime t, long seed) {
        long pos = Math.floorMod(t.toInstant().toEpochMilli(), cycle.toMillis());
        return pos < onTime.toMillis() ? onWatts : standbyWatts;
    }

    public double dutyCycle() {
        return (double) onTime.toMillis() / cycle.toMillis();
    }
}
