package com.elssolution.energymonitor.sensor.simulation;

import com.elssolution.energymonitor.config.MonitorProperties.HourWindow;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Load that only runs inside configured hours (air conditioning, laundry).
 * With {@code staged} the run ramps: fill (30%) for the first tenth, full load, then 60% for the last fifth.
 */
public record PeakHoursProfile(double peakWatts, double standbyWatts, List<HourWindow> activeHours,
                               boolean staged, double jitter) implements ApplianceProfile {

    @Override
    public double baseWatts(ZonedDateTime t, long seed) {
        LocalTime now = t.toLocalTime();
        for (HourWindow w : activeHours) {
            if (w.contains(now)) {
                return staged ? peakWatts * stageFactor(w, now) : peakWatts;
            }
        }
        return standbyWatts;
    }

    private static double stageFactor(HourWindow w, LocalTime now) {
        long len = windowSeconds(w);
        if (len <= 0) return 1.0;
        long into = Math.floorMod(now.toSecondOfDay() - w.getStart().toSecondOfDay(), 86_400);
        double progress = (double) into / len;
        if (progress < 0.1) return 0.3;
        if (progress < 0.8) return 1.0;
        return 0.6;
    }

    private static long windowSeconds(HourWindow w) {
        long d = Duration.between(w.getStart(), w.getEnd()).getSeconds();
        return d > 0 ? d : d + 86_400;
    }
}
