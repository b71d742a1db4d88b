package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.*;
import com.elssolution.energymonitor.service.TariffService;
import com.elssolution.energymonitor.store.InMemoryReadingStore;
import com.elssolution.energymonitor.support.Fixtures;
import com.elssolution.energymonitor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

import static com.elssolution.energymonitor.support.Fixtures.count;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RuleBasedAnalyzerTest {

    /** A Monday. */
    private static final Instant T0 = Instant.parse("2024-05-06T00:00:00Z");
    private static final TimeRange DAY = new TimeRange(T0, T0.plus(Duration.ofDays(1)));
    private static final int MINUTES_PER_DAY = 1440;

    private MonitorProperties props;
    private MutableClock clock;
    private InMemoryReadingStore store;
    private DeviceRegistry registry;
    private RuleBasedAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        props = Fixtures.props();
        props.getDevices().put("heater", Fixtures.device(DeviceType.GENERIC, 0, 1000));
        props.getDevices().put("tv", Fixtures.device(DeviceType.TV, 1, 1000));
        clock = new MutableClock(DAY.to());
        store = new InMemoryReadingStore();
        rebuild();
    }

    private void rebuild() {
        registry = new DeviceRegistry(props);
        analyzer = new RuleBasedAnalyzer(store, registry, new TariffService(props, clock), props, clock);
    }

    /** One reading per minute across the day; energy and cost as the collector would store them. */
    private static List<Reading> minuteReadings(String id, IntToDoubleFunction powerAt) {
        List<Reading> out = new ArrayList<>(MINUTES_PER_DAY);
        for (int i = 0; i < MINUTES_PER_DAY; i++) {
            double w = powerAt.applyAsDouble(i);
            double wh = i == 0 ? 0.0 : w / 60.0;
            out.add(Fixtures.reading(id, T0.plusSeconds(60L * i), w, wh, wh / 1000.0 * 0.1168));
        }
        return out;
    }

    private void store(String id, IntToDoubleFunction powerAt) {
        minuteReadings(id, powerAt).forEach(store::append);
    }

    private UsagePattern patternOf(IntToDoubleFunction powerAt) {
        Device heater = registry.require("heater");
        return analyzer.analyzeDevice(heater, minuteReadings("heater", powerAt), DAY).getPattern();
    }

    // ---- insufficient data ----

    @Test
    void window_shorter_than_poll_interval_gives_empty_report() {
        store("heater", i -> 500);

        AnalysisReport r = analyzer.analyze(AnalysisScope.system(), new TimeRange(T0, T0.plusSeconds(30)));

        assertThat(r.getDevices()).isEmpty();
        assertThat(r.getInsights()).isEmpty();
        assertThat(r.getGeneratedAt()).isEqualTo(clock.instant());
    }

    @Test
    void device_window_is_checked_against_that_device_polling_interval() {
        props.getDevices().get("heater").setPollingInterval(Duration.ofHours(2));
        rebuild();
        store("heater", i -> 500);
        store("tv", i -> 80);
        TimeRange hour = new TimeRange(T0, T0.plus(Duration.ofHours(1)));

        assertThat(analyzer.analyze(AnalysisScope.device("heater"), hour).getDevices()).isEmpty();
        assertThat(analyzer.analyze(AnalysisScope.device("tv"), hour).getDevices())
                .extracting(DeviceAnalysis::getDeviceId).containsExactly("tv");
        assertThat(analyzer.analyze(AnalysisScope.system(), hour).getDevices())
                .extracting(DeviceAnalysis::getDeviceId).containsExactlyInAnyOrder("heater", "tv");
    }

    @Test
    void window_without_readings_gives_empty_report() {
        AnalysisReport r = analyzer.analyze(AnalysisScope.device("heater"), DAY);

        assertThat(r.getDevices()).isEmpty();
        assertThat(r.getInsights()).isEmpty();
        assertThat(r.getScope()).isEqualTo(AnalysisScope.device("heater"));
    }

    @Test
    void unknown_device_is_refused() {
        assertThatThrownBy(() -> analyzer.analyze(AnalysisScope.device("ghost"), DAY))
                .isInstanceOf(DeviceRegistry.UnknownDeviceException.class)
                .hasMessageContaining("ghost");
    }

    // ---- classification ----

    @Test
    void constant_load_is_always_on() {
        assertThat(patternOf(i -> 500)).isEqualTo(UsagePattern.ALWAYS_ON);
    }

    @Test
    void thirty_percent_duty_is_intermittent() {
        assertThat(patternOf(i -> i % 10 < 3 ? 500 : 0)).isEqualTo(UsagePattern.INTERMITTENT);
    }

    @Test
    void rare_heavy_burst_is_peak_only() {
        assertThat(patternOf(i -> i == 100 ? 800 : 0)).isEqualTo(UsagePattern.PEAK_ONLY);
    }

    @Test
    void rare_light_use_is_idle() {
        assertThat(patternOf(i -> i == 100 ? 60 : 2)).isEqualTo(UsagePattern.IDLE);
    }

    // ---- anomalies ----

    @Test
    void single_spike_is_flagged_without_touching_stored_data() {
        store("heater", i -> i == 700 ? 1000 : 100);

        DeviceAnalysis a = analyzer.analyze(AnalysisScope.device("heater"), DAY).getDevices().get(0);

        assertThat(a.getAnomalies()).singleElement().satisfies(x -> {
            assertThat(x.timestamp()).isEqualTo(T0.plusSeconds(700 * 60L));
            assertThat(x.powerW()).isEqualTo(1000.0);
            assertThat(x.thresholdW()).isBetween(100.0, 1000.0);
        });
        assertThat(store.latest("heater")).map(Reading::getPowerW).contains(100.0);
        assertThat(count(store, "heater")).isEqualTo(MINUTES_PER_DAY);
    }

    @Test
    void steady_load_has_no_anomalies() {
        store("heater", i -> 250);

        assertThat(analyzer.analyze(AnalysisScope.device("heater"), DAY).getDevices().get(0).getAnomalies()).isEmpty();
    }

    // ---- reports ----

    @Test
    void system_report_is_ranked_and_stamped() {
        store("heater", i -> i % 10 < 3 ? 900 : 0);
        store("tv", i -> i % 60 < 20 ? 120 : 8);

        AnalysisReport r = analyzer.analyze(AnalysisScope.system(), DAY);

        assertThat(r.getDevices()).extracting(DeviceAnalysis::getDeviceId).containsExactly("heater", "tv");
        List<Insight> insights = r.getInsights();
        assertThat(insights).isNotEmpty();
        for (int i = 0; i < insights.size(); i++) {
            Insight cur = insights.get(i);
            assertThat(cur.getPriority()).isEqualTo(i + 1);
            assertThat(cur.getGeneratedAt()).isEqualTo(clock.instant());
            assertThat(cur.getValidUntil()).isEqualTo(clock.instant().plus(props.getAnalysis().getCacheTtl()));
            assertThat(cur.getEstimatedSavings()).isGreaterThanOrEqualTo(0.0);
            if (i > 0) {
                Insight prev = insights.get(i - 1);
                assertThat(prev.getEstimatedSavings()).isGreaterThanOrEqualTo(cur.getEstimatedSavings());
                if (prev.getEstimatedSavings() == cur.getEstimatedSavings()) {
                    assertThat(prev.getCategory().setupEffort()).isLessThanOrEqualTo(cur.getCategory().setupEffort());
                }
            }
        }
        assertThat(insights).extracting(Insight::getMessage)
                .anySatisfy(m -> assertThat(m).contains("biggest consumer").contains("heater"));
        // device-level environmental notes are folded into the system one
        assertThat(insights).filteredOn(i -> i.getCategory() == InsightCategory.ENVIRONMENTAL)
                .singleElement()
                .extracting(Insight::getScope)
                .isEqualTo(AnalysisScope.system());
    }

    @Test
    void device_report_only_speaks_about_that_device() {
        store("heater", i -> i % 10 < 3 ? 900 : 0);
        store("tv", i -> 100);

        AnalysisReport r = analyzer.analyze(AnalysisScope.device("heater"), DAY);

        assertThat(r.getDevices()).extracting(DeviceAnalysis::getDeviceId).containsExactly("heater");
        assertThat(r.getInsights()).isNotEmpty()
                .allSatisfy(i -> assertThat(i.getScope()).isEqualTo(AnalysisScope.device("heater")));
        assertThat(r.getInsights()).extracting(Insight::getCategory).contains(InsightCategory.ENVIRONMENTAL);
    }

    @Test
    void device_with_corrupt_readings_is_left_out_of_the_report() {
        store("heater", i -> i % 10 < 3 ? 900 : 0);
        store.append(Fixtures.reading("tv", T0, Double.NaN, 0.0, 0.0));

        AnalysisReport r = analyzer.analyze(AnalysisScope.system(), DAY);

        assertThat(r.getDevices()).extracting(DeviceAnalysis::getDeviceId).containsExactly("heater");
        assertThat(r.getInsights()).isNotEmpty();
    }

    @Test
    void time_of_use_tariff_suggests_moving_peak_load() {
        props.getTariff().getTimeOfUse().setEnabled(true);
        rebuild();
        // 17:00-19:59 falls in the weekday peak window
        store("heater", i -> i >= 17 * 60 && i < 20 * 60 ? 900 : 0);

        AnalysisReport r = analyzer.analyze(AnalysisScope.system(), DAY);

        assertThat(r.getInsights())
                .filteredOn(i -> i.getMessage().contains("peak-price hours"))
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getCategory()).isEqualTo(InsightCategory.COST);
                    assertThat(i.getEstimatedSavings()).isPositive();
                });
    }

    @Test
    void statistics_describe_the_window() {
        store("heater", i -> i % 10 < 3 ? 900 : 0);

        DeviceStatistics s = analyzer.analyze(AnalysisScope.device("heater"), DAY).getDevices().get(0).getStatistics();

        assertThat(s.getSampleCount()).isEqualTo(MINUTES_PER_DAY);
        assertThat(s.getMeanW()).isEqualTo(270.0);
        assertThat(s.getPeakW()).isEqualTo(900.0);
        assertThat(s.getDutyCycle()).isEqualTo(0.3);
        assertThat(s.getDutyCycleVolatility()).isCloseTo(0.0, within(1e-12));
        assertThat(s.getWeekendWeekdayRatio()).isZero();
        assertThat(s.getStatus()).isEqualTo(DeviceStatus.ACTIVE);
    }
}
