package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.DeviceStatistics;
import com.elssolution.energymonitor.domain.EfficiencyScore;
import com.elssolution.energymonitor.domain.Maths;
import com.elssolution.energymonitor.domain.TimeRange;

/**
 * {@code 100 - penalty(peak/average) - penalty(hourly duty-cycle volatility)}, clamped to [0,100].
 * The weights are policy and come from configuration.
 */
public class EfficiencyScorer {

    /** Hourly duty cycles live in [0,1], so their std-dev cannot exceed this. */
    static final double MAX_VOLATILITY = 0.5;

    private final MonitorProperties.Analysis cfg;

    public EfficiencyScorer(MonitorProperties.Analysis cfg) {
        this.cfg = cfg;
    }

    public EfficiencyScore score(DeviceStatistics s, TimeRange period) {
        double par = Maths.safeDiv(s.getPeakW(), s.getMeanW());
        double vol = s.getDutyCycleVolatility();
        return EfficiencyScore.builder()
                .deviceId(s.getDeviceId())
                .periodStart(period.from())
                .periodEnd(period.to())
                .score(Maths.round(score(par, vol), 1))
                .peakToAverageRatio(Maths.round(par, 3))
                .dutyCycleVolatility(Maths.round(vol, 4))
                .dutyCycleConsistency(Maths.round(1.0 - Maths.clamp(vol / MAX_VOLATILITY, 0.0, 1.0), 4))
                .build();
    }

    /** Total for any inputs, NaN and infinities included; always in [0,100]. */
    public double score(double peakToAverage, double volatility) {
        double parPenalty = penalty(peakToAverage - 1.0, cfg.getPeakToAveragePenaltyPerUnit(), cfg.getMaxPeakToAveragePenalty());
        double volPenalty = penalty(volatility, cfg.getVolatilityPenaltyPerUnit(), cfg.getMaxVolatilityPenalty());
        double s = 100.0 - parPenalty - volPenalty;
        if (Double.isNaN(s)) return 0.0;
        return Maths.clamp(s, 0.0, 100.0);
    }

    private static double penalty(double excess, double perUnit, double cap) {
        if (!Double.isFinite(excess)) return cap;
        return Math.min(cap, perUnit * Math.max(0.0, excess));
    }
}
