package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.alerts.AlertService;
import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.*;
import com.elssolution.energymonitor.sensor.SensorSources;
import com.elssolution.energymonitor.sensor.simulation.CyclicProfile;
import com.elssolution.energymonitor.sensor.simulation.SimulatedSensorSource;
import com.elssolution.energymonitor.service.CollectorService;
import com.elssolution.energymonitor.service.EnergyCalculator;
import com.elssolution.energymonitor.service.TariffService;
import com.elssolution.energymonitor.store.InMemoryReadingStore;
import com.elssolution.energymonitor.support.Fixtures;
import com.elssolution.energymonitor.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static com.elssolution.energymonitor.support.Fixtures.count;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

/**
 * A simulated fridge-like load (150 W for 5 of every 30 minutes) collected once a minute for a
 * day, then analysed.
 */
class EndToEndSimulationTest {

    private static final Instant T0 = Instant.parse("2024-03-04T00:00:00Z");
    private static final TimeRange DAY = new TimeRange(T0, T0.plus(Duration.ofDays(1)));

    private final ExecutorService workers = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void one_simulated_day_is_collected_integrated_and_classified() {
        MonitorProperties props = Fixtures.props();
        props.getDevices().put("cooler", Fixtures.device(DeviceType.GENERIC, 0, 200));
        MutableClock clock = new MutableClock(T0);
        DeviceRegistry registry = new DeviceRegistry(props);
        SimulatedSensorSource sim = new SimulatedSensorSource("cooler",
                new CyclicProfile(150, 0, Duration.ofMinutes(30), Duration.ofMinutes(5), 0.05), 1.0, clock);
        InMemoryReadingStore store = new InMemoryReadingStore();
        TariffService tariff = new TariffService(props, clock);
        CollectorService collector = new CollectorService(props, registry, new SensorSources(Map.of("cooler", sim)),
                new EnergyCalculator(), tariff, store, new AlertService(), mock(ScheduledExecutorService.class), workers, clock);

        for (int i = 0; i < 1440; i++) {
            assertThat(collector.runTick().getOk()).isEqualTo(1);
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(count(store, "cooler")).isEqualTo(1440);
        assertThat(store.aggregate("cooler", DAY, AggregateFn.MEAN)).isCloseTo(25.0, within(1.3));
        double energyWh = store.aggregate("cooler", DAY, AggregateFn.SUM, ReadingField.ENERGY_WH);
        assertThat(energyWh).isCloseTo(600.0, within(30.0));
        assertThat(store.aggregate("cooler", DAY, AggregateFn.SUM, ReadingField.COST))
                .isCloseTo(energyWh / 1000.0 * props.getTariff().getRatePerKwh(), within(1e-9));

        AnalysisReport report = new RuleBasedAnalyzer(store, registry, tariff, props, clock)
                .analyze(AnalysisScope.device("cooler"), DAY);

        DeviceAnalysis a = report.getDevices().get(0);
        assertThat(a.getPattern()).isEqualTo(UsagePattern.INTERMITTENT);
        assertThat(a.getStatistics().getDutyCycle()).isCloseTo(5.0 / 30.0, within(1e-9));
        assertThat(a.getEfficiencyScore().getScore()).isBetween(0.0, 100.0);
        assertThat(report.getInsights()).isNotEmpty();
    }
}
