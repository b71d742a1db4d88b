package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.domain.Anomaly;
import com.elssolution.energymonitor.domain.DeviceStatistics;
import com.elssolution.energymonitor.domain.Reading;

import java.util.ArrayList;
import java.util.List;

/** Flags readings above {@code mean + k * stdev} of their own window. Stored readings are never touched. */
class AnomalyDetector {

    private final double k;

    AnomalyDetector(double k) {
        this.k = k;
    }

    double threshold(DeviceStatistics s) {
        return s.getMeanW() + k * s.getStdevW();
    }

    List<Anomaly> detect(DeviceStatistics s, List<Reading> readings) {
        double limit = threshold(s);
        List<Anomaly> out = new ArrayList<>();
        for (Reading r : readings) {
            if (r.getPowerW() > limit) {
                out.add(new Anomaly(r.getDeviceId(), r.getTimestamp(), r.getPowerW(), limit));
            }
        }
        return out;
    }
}
