package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.*;
import com.elssolution.energymonitor.service.TariffService;
import com.elssolution.energymonitor.store.ReadingStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic analyzer: statistics, pattern, anomalies and score per device, then worded
 * insights ranked by estimated savings. Reads the store only; a device that cannot be analysed
 * is left out of the report instead of failing it.
 */
@Slf4j
public class RuleBasedAnalyzer implements InsightProducer {

    private final ReadingStore store;
    private final DeviceRegistry registry;
    private final Clock clock;
    private final Duration defaultInterval;
    private final Duration validity;

    private final UsageStatisticsCalculator statistics;
    private final PatternClassifier classifier;
    private final AnomalyDetector anomalies;
    private final EfficiencyScorer scorer;
    private final InsightComposer composer;

    public RuleBasedAnalyzer(ReadingStore store, DeviceRegistry registry, TariffService tariff,
                             MonitorProperties props, Clock clock) {
        MonitorProperties.Analysis cfg = props.getAnalysis();
        this.store = store;
        this.registry = registry;
        this.clock = clock;
        this.defaultInterval = props.getCollector().getPollInterval();
        this.validity = cfg.getCacheTtl();
        this.statistics = new UsageStatisticsCalculator(cfg, clock.getZone());
        this.classifier = new PatternClassifier(cfg);
        this.anomalies = new AnomalyDetector(cfg.getAnomalyK());
        this.scorer = new EfficiencyScorer(cfg);
        this.composer = new InsightComposer(cfg, tariff);
    }

    @Override
    public AnalysisReport analyze(AnalysisScope scope, TimeRange period) {
        Instant now = clock.instant();
        List<Device> devices = scope.isSystem() ? registry.all() : List.of(registry.require(scope.deviceId()));

        if (period.length().compareTo(minWindow(devices)) < 0) {
            log.debug("analysis_insufficient scope={} reason=window_shorter_than_poll window={}", scope.label(), period.length());
            return AnalysisReport.empty(scope, period, now);
        }

        List<InsightComposer.DeviceFacts> facts = new ArrayList<>();
        for (Device d : devices) {
            List<Reading> readings = new ArrayList<>();
            store.query(d.getId(), period).forEach(readings::add);
            if (readings.isEmpty()) continue;
            try {
                facts.add(new InsightComposer.DeviceFacts(d, analyzeDevice(d, readings, period), readings));
            } catch (AnalysisException e) {
                log.warn("analysis_device_skipped device={} err={}", d.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("analysis_device_failed device={} err={}", d.getId(), e.toString(), e);
            }
        }

        if (facts.isEmpty()) {
            log.debug("analysis_insufficient scope={} reason=no_readings", scope.label());
            return AnalysisReport.empty(scope, period, now);
        }

        List<InsightComposer.Draft> drafts = new ArrayList<>();
        for (InsightComposer.DeviceFacts f : facts) {
            drafts.addAll(composer.forDevice(f, period.to(), !scope.isSystem()));
        }
        if (scope.isSystem()) {
            drafts.addAll(composer.forSystem(facts, homeHourMeans(facts), period.to()));
        }

        List<Insight> ranked = InsightComposer.rank(drafts, now, now.plus(validity));
        log.info("analysis_done scope={} from={} to={} devices={} insights={}",
                scope.label(), period.from(), period.to(), facts.size(), ranked.size());
        return AnalysisReport.builder()
                .scope(scope)
                .periodStart(period.from())
                .periodEnd(period.to())
                .generatedAt(now)
                .devices(facts.stream().map(InsightComposer.DeviceFacts::analysis).toList())
                .insights(ranked)
                .build();
    }

    /** Shortest polling interval among the devices in scope, per-device overrides included. */
    private Duration minWindow(List<Device> devices) {
        Duration min = null;
        for (Device d : devices) {
            Duration interval = d.getPollingInterval() != null ? d.getPollingInterval() : defaultInterval;
            if (min == null || interval.compareTo(min) < 0) min = interval;
        }
        return min != null ? min : defaultInterval;
    }

    DeviceAnalysis analyzeDevice(Device d, List<Reading> readings, TimeRange period) {
        DeviceStatistics s = statistics.compute(d, readings);
        return DeviceAnalysis.builder()
                .deviceId(d.getId())
                .statistics(s)
                .pattern(classifier.classify(d, s))
                .anomalies(List.copyOf(anomalies.detect(s, readings)))
                .efficiencyScore(scorer.score(s, period))
                .build();
    }

    /** Sum over devices of each device's mean power per hour of day. */
    private Map<Integer, Double> homeHourMeans(List<InsightComposer.DeviceFacts> facts) {
        Map<Integer, Double> home = new TreeMap<>();
        for (InsightComposer.DeviceFacts f : facts) {
            statistics.hourOfDayMeans(f.readings()).forEach((h, w) -> home.merge(h, w, Double::sum));
        }
        return home;
    }
}
