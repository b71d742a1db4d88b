package com.elssolution.energymonitor.sensor;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.SourceKind;
import com.elssolution.energymonitor.sensor.simulation.ApplianceProfiles;
import com.elssolution.energymonitor.sensor.simulation.SimulatedSensorSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Device id to {@link SensorSource}, chosen once per device from its configured source kind.
 * Hardware devices share one bus source; every simulated device gets its own instance.
 */
@Slf4j
public class SensorSources {

    private final Map<String, SensorSource> byDevice;

    public SensorSources(DeviceRegistry registry, Supplier<SensorSource> hardwareBus, Clock clock) {
        Map<String, SensorSource> m = new LinkedHashMap<>();
        SensorSource bus = null;
        for (Device d : registry.all()) {
            SensorSource s;
            if (d.getSource() == SourceKind.HARDWARE) {
                if (bus == null) bus = hardwareBus.get();
                s = bus;
            } else {
                s = new SimulatedSensorSource(d.getId(), ApplianceProfiles.forDevice(d), d.getCtRatio() * d.getVoltage(), clock);
            }
            m.put(d.getId(), s);
            log.info("sensor_bound device={} source={} channel={}", d.getId(), s.describe(), d.getChannel());
        }
        this.byDevice = Collections.unmodifiableMap(m);
    }

    public SensorSources(Map<String, SensorSource> byDevice) {
        this.byDevice = Map.copyOf(byDevice);
    }

    public SensorSource forDevice(String deviceId) {
        SensorSource s = byDevice.get(deviceId);
        if (s == null) throw new DeviceRegistry.UnknownDeviceException(deviceId);
        return s;
    }
}
