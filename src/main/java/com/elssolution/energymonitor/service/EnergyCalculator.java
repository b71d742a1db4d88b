package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.RawSample;
import com.elssolution.energymonitor.domain.Reading;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Raw sample to power, power pairs to energy, energy to cost. Stateless; the caller owns the
 * "previous reading" of each device.
 */
@Component
public class EnergyCalculator {

    private static final double SECONDS_PER_HOUR = 3600.0;

    /** Watts; negative or non-finite results (inverted CT wiring, garbage frames) clamp to 0. */
    public double power(double raw, Device device) {
        double w = raw * device.getCtRatio() * device.getVoltage() * device.getCalibrationFactor();
        if (!Double.isFinite(w) || w < 0) return 0.0;
        return w;
    }

    /**
     * Trapezoidal energy (Wh) between the previous reading and a new power value.
     * No predecessor, or no forward time, yields 0.
     */
    public double energyDeltaWh(Reading prev, double newPowerW, double elapsedSeconds) {
        if (prev == null || !(elapsedSeconds > 0) || !Double.isFinite(elapsedSeconds)) return 0.0;
        return (prev.getPowerW() + newPowerW) / 2.0 * elapsedSeconds / SECONDS_PER_HOUR;
    }

    public double costDelta(double energyWh, double ratePerKwh) {
        return energyWh / 1000.0 * ratePerKwh;
    }

    public static double elapsedSeconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1e9;
    }

    /**
     * Builds the reading for {@code sample}. {@code prev} is the last reading of the same device that
     * was actually stored; the elapsed time is measured against it, not assumed from the poll period.
     */
    public Reading integrate(Device device, RawSample sample, Reading prev, double ratePerKwh) {
        Instant ts = Instant.ofEpochMilli(sample.sampledAt());
        double powerW = power(sample.value(), device);
        double wh = prev == null ? 0.0 : energyDeltaWh(prev, powerW, elapsedSeconds(prev.getTimestamp(), ts));
        return Reading.builder()
                .deviceId(device.getId())
                .timestamp(ts)
                .rawValue(sample.value())
                .powerW(powerW)
                .energyWh(wh)
                .cost(costDelta(wh, ratePerKwh))
                .build();
    }
}
