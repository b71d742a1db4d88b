package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.*;
import com.elssolution.energymonitor.service.EnergyCalculator;
import com.elssolution.energymonitor.service.TariffService;

import java.time.Instant;
import java.util.*;

/**
 * Turns computed statistics into worded insights with a 30-day savings estimate, then ranks them.
 *
 * <p>Savings estimates start from the energy above the device's baseline (10th percentile power)
 * over the observed span, projected to 30 days, times a per-category share and the average price
 * actually paid. Phantom load is valued as the whole baseline over 30 days.
 */
class InsightComposer {

    private static final double HOURS_PER_30_DAYS = 720.0;
    private static final int PEAK_HOURS_SHOWN = 3;

    /** Not yet ranked or stamped. */
    record Draft(AnalysisScope scope, InsightCategory category, String message, double savings) {}

    /** One analysed device together with the readings behind it. */
    record DeviceFacts(Device device, DeviceAnalysis analysis, List<Reading> readings) {

        DeviceStatistics stats() {
            return analysis.getStatistics();
        }

        /** First to last reading; the span the stored energy increments cover. */
        double coverageHours() {
            if (readings.size() < 2) return 0.0;
            return EnergyCalculator.elapsedSeconds(readings.get(0).getTimestamp(),
                    readings.get(readings.size() - 1).getTimestamp()) / 3600.0;
        }

        double monthFactor() {
            double h = coverageHours();
            return h > 0 ? HOURS_PER_30_DAYS / h : 0.0;
        }

        double excessWh() {
            return Math.max(0.0, stats().getTotalEnergyWh() - stats().getBaselineW() * coverageHours());
        }
    }

    private final MonitorProperties.Analysis cfg;
    private final TariffService tariff;

    InsightComposer(MonitorProperties.Analysis cfg, TariffService tariff) {
        this.cfg = cfg;
        this.tariff = tariff;
    }

    // ---- Device level ----

    List<Draft> forDevice(DeviceFacts f, Instant at, boolean withEnvironmental) {
        Device d = f.device();
        DeviceStatistics s = f.stats();
        DeviceAnalysis a = f.analysis();
        AnalysisScope scope = AnalysisScope.device(d.getId());
        double rate = averageRate(s, at);
        double excessKwh30 = f.excessWh() * f.monthFactor() / 1000.0;
        List<Draft> out = new ArrayList<>();

        switch (a.getPattern()) {
            case ALWAYS_ON -> out.add(new Draft(scope, InsightCategory.USAGE_PATTERN, String.format(Locale.ROOT,
                    "%s runs almost constantly (on %.0f%% of the time, %.0f W on average). A timer or smart plug could switch it off when not needed.",
                    d.getName(), s.getDutyCycle() * 100, s.getMeanW()),
                    excessKwh30 * cfg.getUsagePatternSavingsShare() * rate));
            case INTERMITTENT -> out.add(new Draft(scope, InsightCategory.USAGE_PATTERN, String.format(Locale.ROOT,
                    "%s cycles on and off (on %.0f%% of the time, %.0f W on average, busiest around %02d:00).",
                    d.getName(), s.getDutyCycle() * 100, s.getMeanW(), s.getPeakHour()),
                    excessKwh30 * cfg.getUsagePatternSavingsShare() * rate));
            case PEAK_ONLY -> out.add(new Draft(scope, InsightCategory.USAGE_PATTERN, String.format(Locale.ROOT,
                    "%s draws up to %.0f W in short bursts, mostly around %02d:00. Running it outside busy hours spreads the load.",
                    d.getName(), s.getPeakW(), s.getPeakHour()),
                    excessKwh30 * cfg.getUsagePatternSavingsShare() * rate));
            case IDLE -> { }
        }

        if (s.getTotalCost() > 0) {
            out.add(new Draft(scope, InsightCategory.COST, String.format(Locale.ROOT,
                    "%s cost %s over this period, about %s per 30 days.",
                    d.getName(), money(s.getTotalCost()), money(s.getTotalCost() * f.monthFactor())),
                    excessKwh30 * cfg.getCostSavingsShare() * rate));
        }

        EfficiencyScore score = a.getEfficiencyScore();
        if (score.getScore() < cfg.getLowScore()) {
            out.add(new Draft(scope, InsightCategory.EFFICIENCY, String.format(Locale.ROOT,
                    "%s scores %.0f/100 for efficiency: its peak is %.1fx its average and its hourly use is irregular (consistency %.0f%%).",
                    d.getName(), score.getScore(), score.getPeakToAverageRatio(), score.getDutyCycleConsistency() * 100),
                    excessKwh30 * cfg.getEfficiencySavingsShare() * rate));
        }

        if (s.getBaselineW() > cfg.getStandbyAlertWatts() && a.getPattern() != UsagePattern.ALWAYS_ON) {
            double phantomKwh30 = s.getBaselineW() * HOURS_PER_30_DAYS / 1000.0;
            out.add(new Draft(scope, InsightCategory.EFFICIENCY, String.format(Locale.ROOT,
                    "%s draws %.1f W even when idle. Unplugging it or using a switched strip saves about %.1f kWh per 30 days.",
                    d.getName(), s.getBaselineW(), phantomKwh30),
                    phantomKwh30 * rate));
        }

        List<Anomaly> anomalies = a.getAnomalies();
        if (!anomalies.isEmpty()) {
            Anomaly worst = anomalies.stream().max(Comparator.comparingDouble(Anomaly::powerW)).orElseThrow();
            double stepHours = f.readings().size() > 1 ? f.coverageHours() / (f.readings().size() - 1) : 0.0;
            double spikeWh = anomalies.stream().mapToDouble(x -> Math.max(0.0, x.powerW() - s.getMeanW())).sum() * stepHours;
            out.add(new Draft(scope, InsightCategory.MAINTENANCE, String.format(Locale.ROOT,
                    "%s had %d unusual power spike%s above %.0f W (highest %.0f W at %s). Check it for wear or a fault.",
                    d.getName(), anomalies.size(), anomalies.size() == 1 ? "" : "s", worst.thresholdW(), worst.powerW(), worst.timestamp()),
                    spikeWh * f.monthFactor() / 1000.0 * rate));
        }

        if (withEnvironmental && s.getTotalEnergyWh() > 0) {
            out.add(environmental(scope, d.getName(), s.getTotalEnergyWh(), f.monthFactor()));
        }
        return out;
    }

    // ---- System level ----

    List<Draft> forSystem(List<DeviceFacts> facts, Map<Integer, Double> homeHourMeans, Instant at) {
        AnalysisScope scope = AnalysisScope.system();
        List<Draft> out = new ArrayList<>();
        double totalWh = 0.0;
        double totalCost = 0.0;
        double coverage = 0.0;
        for (DeviceFacts f : facts) {
            totalWh += f.stats().getTotalEnergyWh();
            totalCost += f.stats().getTotalCost();
            coverage = Math.max(coverage, f.coverageHours());
        }
        if (facts.isEmpty()) return out;
        double monthFactor = coverage > 0 ? HOURS_PER_30_DAYS / coverage : 0.0;

        List<Integer> peakHours = homeHourMeans.entrySet().stream()
                .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed().thenComparing(Map.Entry.<Integer, Double>comparingByKey()))
                .limit(PEAK_HOURS_SHOWN)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        if (!peakHours.isEmpty()) {
            StringJoiner hours = new StringJoiner(", ");
            peakHours.forEach(h -> hours.add(String.format(Locale.ROOT, "%02d:00", h)));
            out.add(new Draft(scope, InsightCategory.USAGE_PATTERN,
                    "Your home uses the most power around " + hours + ".", 0.0));
        }

        DeviceFacts top = facts.stream()
                .max(Comparator.comparingDouble((DeviceFacts f) -> f.stats().getTotalCost())
                        .thenComparing(f -> f.device().getId(), Comparator.reverseOrder()))
                .orElseThrow();
        if (totalCost > 0) {
            out.add(new Draft(scope, InsightCategory.COST, String.format(Locale.ROOT,
                    "%s is the biggest consumer: %s, %.0f%% of the total.",
                    top.device().getName(), money(top.stats().getTotalCost()), top.stats().getTotalCost() / totalCost * 100),
                    0.0));
            out.add(new Draft(scope, InsightCategory.COST, String.format(Locale.ROOT,
                    "At this rate electricity costs about %s per 30 days (%.1f kWh).",
                    money(totalCost * monthFactor), totalWh * monthFactor / 1000.0),
                    0.0));
        }

        if (tariff.isTimeOfUse()) {
            double peakWh = 0.0;
            for (DeviceFacts f : facts) {
                for (Reading r : f.readings()) {
                    if (tariff.periodAt(r.getTimestamp()) == TariffService.Period.PEAK) peakWh += r.getEnergyWh();
                }
            }
            if (peakWh > 0) {
                double shiftKwh30 = peakWh * monthFactor / 1000.0 * cfg.getCostSavingsShare();
                double savings = shiftKwh30 * tariff.peakSpread(at);
                out.add(new Draft(scope, InsightCategory.COST, String.format(Locale.ROOT,
                        "%.1f kWh per 30 days falls in peak-price hours. Moving flexible loads (washer, dryer, dishwasher) to off-peak saves about %s.",
                        peakWh * monthFactor / 1000.0, money(savings)),
                        savings));
            }
        }

        if (totalWh > 0) out.add(environmental(scope, "The monitored devices", totalWh, monthFactor));
        return out;
    }

    // ---- Ranking ----

    /** Savings descending, then lower setup effort, then message; priority is the 1-based rank. */
    static List<Insight> rank(List<Draft> drafts, Instant generatedAt, Instant validUntil) {
        List<Insight> sorted = drafts.stream()
                .map(x -> Insight.builder()
                        .scope(x.scope())
                        .category(x.category())
                        .message(x.message())
                        .estimatedSavings(Maths.round(Double.isFinite(x.savings()) ? Math.max(0.0, x.savings()) : 0.0, 2))
                        .generatedAt(generatedAt)
                        .validUntil(validUntil)
                        .build())
                .sorted(Comparator.comparingDouble(Insight::getEstimatedSavings).reversed()
                        .thenComparingInt(i -> i.getCategory().setupEffort())
                        .thenComparing(Insight::getMessage))
                .toList();
        List<Insight> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) ranked.add(sorted.get(i).withPriority(i + 1));
        return List.copyOf(ranked);
    }

    // ---- helpers ----

    private Draft environmental(AnalysisScope scope, String subject, double energyWh, double monthFactor) {
        double kg = energyWh / 1000.0 * cfg.getCo2KgPerKwh();
        return new Draft(scope, InsightCategory.ENVIRONMENTAL, String.format(Locale.ROOT,
                "%s used %.2f kWh, about %.2f kg of CO2 (%.1f kg per 30 days).",
                subject, energyWh / 1000.0, kg, kg * monthFactor), 0.0);
    }

    /** Price per kWh actually paid in the window; current tariff when nothing was used. */
    private double averageRate(DeviceStatistics s, Instant at) {
        if (s.getTotalEnergyWh() > 0 && s.getTotalCost() > 0) return s.getTotalCost() / (s.getTotalEnergyWh() / 1000.0);
        return tariff.rateAt(at);
    }

    private String money(double v) {
        return String.format(Locale.ROOT, "%s%.2f", tariff.currency(), v);
    }
}
