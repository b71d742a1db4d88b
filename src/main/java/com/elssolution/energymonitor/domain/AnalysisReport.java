package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one analysis request. For a device scope {@code devices} holds exactly that device
 * (or nothing when there was not enough data).
 */
@Value
@Builder
public class AnalysisReport {
    AnalysisScope scope;
    Instant periodStart;
    Instant periodEnd;
    Instant generatedAt;
    List<DeviceAnalysis> devices;
    /** Ranked: descending savings, ties by lower setup effort. */
    List<Insight> insights;

    public static AnalysisReport empty(AnalysisScope scope, TimeRange period, Instant now) {
        return AnalysisReport.builder()
                .scope(scope)
                .periodStart(period.from())
                .periodEnd(period.to())
                .generatedAt(now)
                .devices(List.of())
                .insights(List.of())
                .build();
    }
}
