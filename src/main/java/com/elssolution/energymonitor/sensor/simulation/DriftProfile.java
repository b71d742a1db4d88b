package com.elssolution.energymonitor.sensor.simulation;

import com.elssolution.energymonitor.config.MonitorProperties.HourWindow;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Continuously variable load (TV, computer): during usage hours it swings slowly around
 * {@code baseWatts} by {@code amplitude}; outside them it sits at standby.
 * An empty window list means "in use all day".
 */
public record DriftProfile(double baseWatts, double standbyWatts, double amplitude, Duration driftPeriod,
                           List<HourWindow> usageHours, double jitter) implements ApplianceProfile {

    @Override
    public double baseWatts(ZonedDateTime t, long seed) {
        if (!usageHours.isEmpty() && usageHours.stream().noneMatch(w -> w.contains(t.toLocalTime()))) {
            return standbyWatts;
        }
        double phase = ApplianceProfile.unit(seed, 0) * 2 * Math.PI;
        double x = 2 * Math.PI * t.toInstant().toEpochMilli() / (double) driftPeriod.toMillis();
        return Math.max(standbyWatts, baseWatts * (1.0 + amplitude * Math.sin(x + phase)));
    }
}
