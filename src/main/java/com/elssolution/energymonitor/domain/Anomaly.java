package com.elssolution.energymonitor.domain;

import java.time.Instant;

/**
 * A reading whose power exceeded {@code mean + k*stdev} for its analysis window.
 */
public record Anomaly(String deviceId, Instant timestamp, double powerW, double thresholdW) {}
