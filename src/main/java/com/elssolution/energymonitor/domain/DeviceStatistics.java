package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Window summary of one device's readings. */
@Value
@Builder
public class DeviceStatistics {
    String deviceId;
    int sampleCount;
    double meanW;
    double medianW;
    double stdevW;
    double minW;
    double peakW;
    Instant peakAt;
    /** 10th percentile power; what the device draws when nominally idle. */
    double baselineW;
    double dutyCycle;
    double dutyCycleVolatility;
    double onThresholdW;
    double totalEnergyWh;
    double totalCost;
    int peakHour;
    double weekendWeekdayRatio;
    DeviceStatus status;
}
