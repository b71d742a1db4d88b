package com.elssolution.energymonitor.support;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.DeviceType;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.SourceKind;
import com.elssolution.energymonitor.domain.TimeRange;
import com.elssolution.energymonitor.store.ReadingStore;

import java.time.Duration;
import java.time.Instant;

public final class Fixtures {

    private Fixtures() {}

    /** Properties with unit CT ratio and voltage, so raw values read as watts. */
    public static MonitorProperties props() {
        MonitorProperties p = new MonitorProperties();
        p.getCollector().setInitialBackoff(Duration.ofMillis(1));
        p.getCollector().setReadTimeout(Duration.ofSeconds(1));
        p.getCalibration().setSampleSpacing(Duration.ZERO);
        return p;
    }

    public static MonitorProperties.DeviceProperties device(DeviceType type, int channel, double maxWatts) {
        MonitorProperties.DeviceProperties d = new MonitorProperties.DeviceProperties();
        d.setType(type);
        d.setSource(SourceKind.SIMULATED);
        d.setChannel(channel);
        d.setVoltage(1.0);
        d.setCtRatio(1.0);
        d.setMinWatts(0.0);
        d.setMaxWatts(maxWatts);
        return d;
    }

    public static Reading reading(String deviceId, Instant ts, double powerW, double energyWh, double cost) {
        return Reading.builder()
                .deviceId(deviceId)
                .timestamp(ts)
                .rawValue(powerW)
                .powerW(powerW)
                .energyWh(energyWh)
                .cost(cost)
                .build();
    }

    /** Number of readings stored for {@code deviceId}, whatever their time. */
    public static int count(ReadingStore store, String deviceId) {
        int n = 0;
        for (Reading ignored : store.query(deviceId, new TimeRange(Instant.EPOCH, Instant.parse("2100-01-01T00:00:00Z")))) n++;
        return n;
    }
}
