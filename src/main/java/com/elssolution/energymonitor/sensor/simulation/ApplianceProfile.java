package com.elssolution.energymonitor.sensor.simulation;

import java.time.ZonedDateTime;

/**
 * Load model of one appliance kind. Implementations are pure: the same instant and seed
 * always give the same wattage.
 */
public interface ApplianceProfile {

    /** Load in watts at {@code t} before measurement jitter. */
    double baseWatts(ZonedDateTime t, long seed);

    /** Max relative jitter applied on top of the base load, e.g. 0.05 = +/-5%. */
    double jitter();

    /** Deterministic uniform value in [0,1) for a seed and a slot number. */
    static double unit(long seed, long slot) {
        long z = seed + slot * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        z = z ^ (z >>> 31);
        return (z >>> 11) * 0x1.0p-53;
    }
}
