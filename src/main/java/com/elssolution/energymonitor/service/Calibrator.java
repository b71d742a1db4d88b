package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.Maths;
import com.elssolution.energymonitor.sensor.SensorException;
import com.elssolution.energymonitor.sensor.SensorSource;
import com.elssolution.energymonitor.sensor.SensorSources;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives a device's calibration factor from a reference load of known wattage.
 *
 * <p>The reference gives {@code scale = knownWatts / mean(raw)} watts per raw unit. Power is
 * {@code raw * ct * V * factor}, so the stored factor is {@code scale / (ct * V)}; with unit CT
 * ratio and voltage the two are the same number.
 */
@Slf4j
@Service
public class Calibrator {

    @Value @Builder
    public static class Result {
        String deviceId;
        double knownWatts;
        double meanRaw;
        /** Watts per raw unit, {@code knownWatts / meanRaw}. */
        double scale;
        /** What was stored on the device, {@code scale / (ct * V)}. */
        double factor;
        double previousFactor;
    }

    private final DeviceRegistry registry;
    private final SensorSources sources;
    private final MonitorProperties.Calibration cfg;

    public Calibrator(DeviceRegistry registry, SensorSources sources, MonitorProperties props) {
        this.registry = registry;
        this.sources = sources;
        this.cfg = props.getCalibration();
    }

    /** Watts per raw unit implied by {@code raw} taken under a {@code knownWatts} load. */
    public static double scaleFromSamples(double[] raw, double knownWatts, double minSignal) throws CalibrationException {
        if (!(knownWatts > 0) || !Double.isFinite(knownWatts)) {
            throw new IllegalArgumentException("known watts must be a positive number: " + knownWatts);
        }
        if (raw == null || raw.length == 0) throw new CalibrationException("no reference samples");
        for (double v : raw) {
            if (!Double.isFinite(v)) throw new CalibrationException("non-finite reference sample: " + v);
        }
        double mean = Maths.mean(raw);
        if (Math.abs(mean) < minSignal) {
            throw new CalibrationException("reference signal ~0 (mean=" + mean + "); sensor disconnected?");
        }
        if (mean < 0) {
            throw new CalibrationException("negative reference signal (mean=" + mean + "); CT clamp reversed?");
        }
        return knownWatts / mean;
    }

    /**
     * Samples the device under the reference load and stores the new factor.
     *
     * @throws CalibrationException when sampling fails or the signal is unusable
     */
    public Result calibrate(String deviceId, double knownWatts) throws CalibrationException {
        Device d = registry.require(deviceId);
        SensorSource source = sources.forDevice(deviceId);
        int n = Math.max(1, cfg.getSamples());
        double[] raw = new double[n];

        log.info("calibration_start device={} knownW={} samples={}", deviceId, knownWatts, n);
        for (int i = 0; i < n; i++) {
            if (i > 0) pause(cfg.getSampleSpacing().toMillis());
            try {
                raw[i] = source.read(d.getChannel()).value();
            } catch (SensorException e) {
                log.warn("calibration_failed device={} sample={} err={}", deviceId, i, e.toString());
                throw new CalibrationException("reading reference sample " + i + " failed: " + e.getMessage(), e);
            }
        }

        double scale;
        try {
            scale = scaleFromSamples(raw, knownWatts, cfg.getMinSignal());
        } catch (CalibrationException e) {
            log.warn("calibration_failed device={} err={}", deviceId, e.getMessage());
            throw e;
        }
        double factor = scale / (d.getCtRatio() * d.getVoltage());
        double previous = d.getCalibrationFactor();
        d.applyCalibration(factor);
        double meanRaw = Maths.mean(raw);
        log.info("calibration_done device={} scale={} factor={} previous={} meanRaw={}",
                deviceId, scale, factor, previous, meanRaw);
        return Result.builder()
                .deviceId(deviceId)
                .knownWatts(knownWatts)
                .meanRaw(meanRaw)
                .scale(scale)
                .factor(factor)
                .previousFactor(previous)
                .build();
    }

    private static void pause(long ms) throws CalibrationException {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalibrationException("calibration interrupted", e);
        }
    }
}
