package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.DeviceStatistics;
import com.elssolution.energymonitor.domain.DeviceStatus;
import com.elssolution.energymonitor.domain.Maths;
import com.elssolution.energymonitor.domain.Reading;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Window statistics for one device. Works on the readings already materialized for the window.
 */
class UsageStatisticsCalculator {

    private static final double BASELINE_PERCENTILE = 0.10;

    private final MonitorProperties.Analysis cfg;
    private final ZoneId zone;

    UsageStatisticsCalculator(MonitorProperties.Analysis cfg, ZoneId zone) {
        this.cfg = cfg;
        this.zone = zone;
    }

    double onThreshold(Device d) {
        return cfg.getOnThresholdFraction() * d.ratedMaxWatts();
    }

    DeviceStatistics compute(Device d, List<Reading> readings) {
        if (readings.isEmpty()) throw new AnalysisException("no readings for " + d.getId());
        int n = readings.size();
        double[] power = new double[n];
        double energyWh = 0.0;
        double cost = 0.0;
        double peak = -1.0;
        Instant peakAt = null;
        for (int i = 0; i < n; i++) {
            Reading r = readings.get(i);
            double w = r.getPowerW();
            if (!Double.isFinite(w)) throw new AnalysisException("non-finite power in " + d.getId() + " at " + r.getTimestamp());
            power[i] = w;
            energyWh += r.getEnergyWh();
            cost += r.getCost();
            if (w > peak) {
                peak = w;
                peakAt = r.getTimestamp();
            }
        }

        double onW = onThreshold(d);
        double mean = Maths.mean(power);
        double min = power[0];
        for (double w : power) min = Math.min(min, w);

        return DeviceStatistics.builder()
                .deviceId(d.getId())
                .sampleCount(n)
                .meanW(mean)
                .medianW(Maths.median(power))
                .stdevW(Maths.stdev(power))
                .minW(min)
                .peakW(peak)
                .peakAt(peakAt)
                .baselineW(Maths.percentile(power, BASELINE_PERCENTILE))
                .dutyCycle(dutyCycle(power, onW))
                .dutyCycleVolatility(hourlyDutyVolatility(readings, onW))
                .onThresholdW(onW)
                .totalEnergyWh(energyWh)
                .totalCost(cost)
                .peakHour(peakHour(readings))
                .weekendWeekdayRatio(weekendWeekdayRatio(readings))
                .status(DeviceStatus.of(mean, cfg.getActiveThresholdW(), cfg.getStandbyThresholdW()))
                .build();
    }

    static double dutyCycle(double[] power, double onW) {
        if (power.length == 0) return 0.0;
        int on = 0;
        for (double w : power) if (w > onW) on++;
        return (double) on / power.length;
    }

    /** Std-dev of the duty cycle of each clock hour in the window; 0 with fewer than two hours. */
    double hourlyDutyVolatility(List<Reading> readings, double onW) {
        Map<Instant, int[]> buckets = new TreeMap<>();
        for (Reading r : readings) {
            Instant hour = r.getTimestamp().atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant();
            int[] c = buckets.computeIfAbsent(hour, k -> new int[2]);
            if (r.getPowerW() > onW) c[0]++;
            c[1]++;
        }
        double[] duty = buckets.values().stream().mapToDouble(c -> (double) c[0] / c[1]).toArray();
        return Maths.stdev(duty);
    }

    /** Mean power per hour of day (0..23); hours without readings are absent. */
    Map<Integer, Double> hourOfDayMeans(List<Reading> readings) {
        Map<Integer, double[]> acc = new TreeMap<>();
        for (Reading r : readings) {
            double[] a = acc.computeIfAbsent(r.getTimestamp().atZone(zone).getHour(), k -> new double[2]);
            a[0] += r.getPowerW();
            a[1]++;
        }
        Map<Integer, Double> out = new TreeMap<>();
        acc.forEach((h, a) -> out.put(h, a[0] / a[1]));
        return out;
    }

    int peakHour(List<Reading> readings) {
        int best = 0;
        double bestMean = -1.0;
        for (Map.Entry<Integer, Double> e : hourOfDayMeans(readings).entrySet()) {
            if (e.getValue() > bestMean) {
                bestMean = e.getValue();
                best = e.getKey();
            }
        }
        return best;
    }

    /** Weekend mean over weekday mean; 0 unless both kinds of day are present. */
    double weekendWeekdayRatio(List<Reading> readings) {
        double we = 0, wd = 0;
        int nWe = 0, nWd = 0;
        for (Reading r : readings) {
            ZonedDateTime t = r.getTimestamp().atZone(zone);
            DayOfWeek dow = t.getDayOfWeek();
            if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
                we += r.getPowerW();
                nWe++;
            } else {
                wd += r.getPowerW();
                nWd++;
            }
        }
        if (nWe == 0 || nWd == 0) return 0.0;
        return Maths.safeDiv(we / nWe, wd / nWd);
    }
}
