package com.elssolution.energymonitor.sensor.simulation;

import com.elssolution.energymonitor.domain.RawSample;
import com.elssolution.energymonitor.sensor.SensorSource;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * Simulated CT sensor for one device. The sample is the profile's load at the current clock
 * time plus bounded jitter, both derived from the device id, so two runs over the same clock
 * readings produce the same trace.
 */
public class SimulatedSensorSource implements SensorSource {

    private final String deviceId;
    private final ApplianceProfile profile;
    /** Watts represented by one raw unit at calibration factor 1 (ct ratio * voltage). */
    private final double wattsPerUnit;
    private final Clock clock;
    private final long seed;

    public SimulatedSensorSource(String deviceId, ApplianceProfile profile, double wattsPerUnit, Clock clock) {
        this(deviceId, profile, wattsPerUnit, clock, seedOf(deviceId));
    }

    public SimulatedSensorSource(String deviceId, ApplianceProfile profile, double wattsPerUnit, Clock clock, long seed) {
        if (wattsPerUnit <= 0) throw new IllegalArgumentException("wattsPerUnit must be > 0");
        this.deviceId = deviceId;
        this.profile = profile;
        this.wattsPerUnit = wattsPerUnit;
        this.clock = clock;
        this.seed = seed;
    }

    @Override
    public RawSample read(int channel) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        long ms = now.toInstant().toEpochMilli();
        double base = profile.baseWatts(now, seed);
        double u = ApplianceProfile.unit(seed ^ 0x5DEECE66DL, ms);
        double watts = Math.max(0.0, base * (1.0 + profile.jitter() * (2 * u - 1)));
        return new RawSample(channel, watts / wattsPerUnit, ms);
    }

    @Override
    public String describe() {
        return "sim:" + deviceId;
    }

    static long seedOf(String deviceId) {
        return 0x9E3779B97F4A7C15L * deviceId.hashCode() + 0x632BE59BD9B4E019L;
    }
}
