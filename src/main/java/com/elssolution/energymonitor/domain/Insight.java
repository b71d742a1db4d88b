package com.elssolution.energymonitor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/** A generated statement with its savings estimate and ranking. Read-only to consumers. */
@Value
@Builder
public class Insight {
    AnalysisScope scope;
    InsightCategory category;
    String message;
    /** Currency units per 30 days. */
    double estimatedSavings;
    /** 1 is the most important. */
    @With int priority;
    Instant generatedAt;
    Instant validUntil;
}
