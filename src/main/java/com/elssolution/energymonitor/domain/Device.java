package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * A monitored load. Built once from configuration; only the calibration factor changes afterwards.
 */
@Getter
@ToString
public class Device {
    private final String id;
    private final String name;
    private final String location;
    private final DeviceType type;
    private final SourceKind source;
    private final int channel;
    private final double voltage;
    private final double ctRatio;
    private final double minWatts;
    private final double maxWatts;
    /** Null when the device follows the collector's global cadence. */
    private final Duration pollingInterval;

    private volatile double calibrationFactor;

    @Builder
    private Device(String id, String name, String location, DeviceType type, SourceKind source,
                   int channel, double voltage, double ctRatio, Double calibrationFactor,
                   double minWatts, double maxWatts, Duration pollingInterval) {
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.location = location == null ? "" : location;
        this.type = type == null ? DeviceType.GENERIC : type;
        this.source = source == null ? SourceKind.SIMULATED : source;
        this.channel = channel;
        this.voltage = voltage;
        this.ctRatio = ctRatio;
        this.calibrationFactor = calibrationFactor == null ? 1.0 : calibrationFactor;
        this.minWatts = minWatts;
        this.maxWatts = maxWatts;
        this.pollingInterval = pollingInterval;
    }

    /** Only the calibrator writes this. */
    public void applyCalibration(double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new IllegalArgumentException("calibration factor must be positive and finite: " + factor);
        }
        this.calibrationFactor = factor;
    }

    /** Rated max wattage used for on-thresholds and peak-only checks. */
    public double ratedMaxWatts() {
        return maxWatts;
    }
}
