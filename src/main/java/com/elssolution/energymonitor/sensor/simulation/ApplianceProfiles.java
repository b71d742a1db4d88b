package com.elssolution.energymonitor.sensor.simulation;

import com.elssolution.energymonitor.config.MonitorProperties.HourWindow;
import com.elssolution.energymonitor.domain.Device;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

/** Default load model per device type. */
public final class ApplianceProfiles {

    private static final double JITTER = 0.05;

    private ApplianceProfiles() {}

    public static ApplianceProfile forDevice(Device d) {
        return switch (d.getType()) {
            case FRIDGE -> new CyclicProfile(180, 40, Duration.ofMinutes(45), Duration.ofMinutes(15), JITTER);
            case TV -> new DriftProfile(120, 2, 0.2, Duration.ofMinutes(40),
                    List.of(window(18, 0, 23, 0), window(7, 0, 9, 0)), JITTER);
            case COMPUTER -> new DriftProfile(250, 8, 0.4, Duration.ofMinutes(20),
                    List.of(window(9, 0, 17, 0), window(19, 0, 23, 0)), JITTER);
            case AC -> new PeakHoursProfile(2000, 5, List.of(window(14, 0, 22, 0)), false, JITTER);
            case MICROWAVE -> new BurstProfile(1200, 2, Duration.ofMinutes(3), 0.01, JITTER);
            case WASHER -> new PeakHoursProfile(600, 2, List.of(window(10, 0, 11, 0)), true, JITTER);
            case DRYER -> new PeakHoursProfile(2500, 3, List.of(window(11, 0, 11, 45)), true, JITTER);
            case GENERIC -> new DriftProfile((d.getMinWatts() + d.getMaxWatts()) / 2, 1, 0.3,
                    Duration.ofHours(1), List.of(), JITTER);
        };
    }

    static HourWindow window(int h1, int m1, int h2, int m2) {
        return new HourWindow(LocalTime.of(h1, m1), LocalTime.of(h2, m2));
    }
}
