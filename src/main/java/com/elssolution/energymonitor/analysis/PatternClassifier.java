package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.DeviceStatistics;
import com.elssolution.energymonitor.domain.UsagePattern;

class PatternClassifier {

    private final MonitorProperties.Analysis cfg;

    PatternClassifier(MonitorProperties.Analysis cfg) {
        this.cfg = cfg;
    }

    UsagePattern classify(Device d, DeviceStatistics s) {
        double duty = s.getDutyCycle();
        if (duty > cfg.getAlwaysOnDutyCycle()) return UsagePattern.ALWAYS_ON;
        if (duty >= cfg.getIntermittentDutyCycle()) return UsagePattern.INTERMITTENT;
        if (s.getPeakW() >= cfg.getPeakOnlyPeakFraction() * d.ratedMaxWatts()) return UsagePattern.PEAK_ONLY;
        return UsagePattern.IDLE;
    }
}
