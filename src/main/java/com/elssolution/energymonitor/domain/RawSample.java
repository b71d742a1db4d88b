package com.elssolution.energymonitor.domain;

/**
 * One raw sensor value as delivered by a {@code SensorSource}, before any scaling.
 *
 * @param channel   ADC channel the value came from
 * @param value     raw sample (volts at the burden resistor for the hardware bridge)
 * @param sampledAt epoch ms when the transfer completed
 */
public record RawSample(int channel, double value, long sampledAt) {}
