package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.domain.AnalysisReport;
import com.elssolution.energymonitor.domain.AnalysisScope;
import com.elssolution.energymonitor.domain.TimeRange;

/**
 * Produces statistics, patterns, scores and ranked insights for a scope and period.
 * Today's implementation is rule based; a model-backed one plugs in behind the same method.
 */
public interface InsightProducer {

    /**
     * Never fails for lack of data: a window shorter than one poll interval, or one without
     * readings, gives an empty report.
     *
     * @throws com.elssolution.energymonitor.config.DeviceRegistry.UnknownDeviceException for a device scope naming no configured device
     */
    AnalysisReport analyze(AnalysisScope scope, TimeRange period);
}
