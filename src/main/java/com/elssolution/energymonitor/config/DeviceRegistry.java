package com.elssolution.energymonitor.config;

import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.SourceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The configured device table, validated once. Any problem here is a startup failure.
 */
@Slf4j
public class DeviceRegistry {

    private static final int MAX_ADC_CHANNEL = 7;

    private final Map<String, Device> devices;

    public DeviceRegistry(MonitorProperties props) {
        Map<String, MonitorProperties.DeviceProperties> table = props.getDevices();
        if (table == null || table.isEmpty()) {
            throw new IllegalStateException("monitor.devices is empty: nothing to collect");
        }

        Map<String, Device> built = new LinkedHashMap<>();
        Map<Integer, String> hardwareChannels = new HashMap<>();
        List<String> problems = new ArrayList<>();

        table.forEach((id, p) -> {
            SourceKind source = p.getSource() != null ? p.getSource() : props.getSensor().getMode();
            if (p.getVoltage() <= 0) problems.add(id + ": voltage must be > 0");
            if (p.getCtRatio() <= 0) problems.add(id + ": ct-ratio must be > 0");
            if (p.getCalibrationFactor() != null && p.getCalibrationFactor() <= 0) {
                problems.add(id + ": calibration-factor must be > 0");
            }
            if (p.getMaxWatts() <= p.getMinWatts()) problems.add(id + ": max-watts must exceed min-watts");
            if (p.getPollingInterval() != null && (p.getPollingInterval().isNegative() || p.getPollingInterval().isZero())) {
                problems.add(id + ": polling-interval must be positive");
            }
            if (source == SourceKind.HARDWARE) {
                if (p.getChannel() < 0 || p.getChannel() > MAX_ADC_CHANNEL) {
                    problems.add(id + ": channel " + p.getChannel() + " outside 0.." + MAX_ADC_CHANNEL);
                }
                String other = hardwareChannels.putIfAbsent(p.getChannel(), id);
                if (other != null) problems.add(id + ": channel " + p.getChannel() + " already used by " + other);
            }

            built.put(id, Device.builder()
                    .id(id)
                    .name(p.getName())
                    .location(p.getLocation())
                    .type(p.getType())
                    .source(source)
                    .channel(p.getChannel())
                    .voltage(p.getVoltage())
                    .ctRatio(p.getCtRatio())
                    .calibrationFactor(p.getCalibrationFactor())
                    .minWatts(p.getMinWatts())
                    .maxWatts(p.getMaxWatts())
                    .pollingInterval(p.getPollingInterval())
                    .build());
        });

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid device configuration: " + String.join("; ", problems));
        }
        this.devices = Collections.unmodifiableMap(built);
        log.info("device_registry_loaded count={} ids={}", devices.size(), devices.keySet());
    }

    public List<Device> all() {
        return List.copyOf(devices.values());
    }

    public Optional<Device> find(String id) {
        return Optional.ofNullable(devices.get(id));
    }

    public Device require(String id) {
        Device d = devices.get(id);
        if (d == null) throw new UnknownDeviceException(id);
        return d;
    }

    public int size() {
        return devices.size();
    }

    public static class UnknownDeviceException extends RuntimeException {
        public UnknownDeviceException(String id) {
            super("Unknown device: " + id);
        }
    }
}
