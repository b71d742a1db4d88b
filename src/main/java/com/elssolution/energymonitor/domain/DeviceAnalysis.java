package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DeviceAnalysis {
    String deviceId;
    DeviceStatistics statistics;
    UsagePattern pattern;
    List<Anomaly> anomalies;
    EfficiencyScore efficiencyScore;
}
