package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EfficiencyScore {
    String deviceId;
    Instant periodStart;
    Instant periodEnd;
    /** Always within [0,100]. */
    double score;
    double peakToAverageRatio;
    /** Std-dev of hourly duty cycles; 0 means perfectly regular. */
    double dutyCycleVolatility;
    /** 1 - normalized volatility, in [0,1]. */
    double dutyCycleConsistency;
}
