package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.DeviceStatus;
import com.elssolution.energymonitor.domain.Maths;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.TimeRange;
import com.elssolution.energymonitor.store.ReadingStore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only summaries over the store: what is drawing power right now, what a day cost, how the
 * month is tracking.
 */
@Slf4j
@Service
public class UsageReportService {

    private static final int DAILY_TOP = 3;
    private static final int MONTHLY_TOP = 5;
    private static final int DAYS_PER_MONTH = 30;

    // ---- Views ----
    @Value @Builder
    public static class DevicePower {
        String deviceId;
        String name;
        String location;
        double powerW;
        DeviceStatus status;
        Instant lastSeen;
    }

    @Value @Builder
    public static class PowerSummary {
        Instant generatedAt;
        double totalPowerW;
        int activeDevices;
        double currentRate;
        double projectedDailyCost;
        double projectedMonthlyCost;
        String currency;
        List<DevicePower> devices;
    }

    @Value @Builder
    public static class Consumer {
        String deviceId;
        String name;
        double energyKwh;
        double cost;
    }

    @Value @Builder
    public static class DailyReport {
        LocalDate date;
        double energyKwh;
        double cost;
        double peakPowerW;
        /** Home's average total power: sum of each reporting device's mean power. */
        double averagePowerW;
        int readings;
        String currency;
        List<Consumer> topConsumers;
    }

    @Value @Builder
    public static class MonthlySummary {
        YearMonth month;
        int daysElapsed;
        double energyKwh;
        double cost;
        double peakPowerW;
        double averageDailyKwh;
        int activeDevices;
        double projectedKwh;
        double projectedCost;
        String currency;
        List<Consumer> topConsumers;
    }

    private final ReadingStore store;
    private final DeviceRegistry registry;
    private final TariffService tariff;
    private final MonitorProperties.Analysis thresholds;
    private final Clock clock;

    public UsageReportService(ReadingStore store, DeviceRegistry registry, TariffService tariff,
                              MonitorProperties props, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.tariff = tariff;
        this.thresholds = props.getAnalysis();
        this.clock = clock;
    }

    // ---------------------- Public API ----------------------

    /** Latest reading per device; devices never read show 0 W and OFF. */
    public PowerSummary currentPower() {
        Instant now = clock.instant();
        List<DevicePower> rows = new ArrayList<>();
        double total = 0.0;
        int active = 0;
        for (Device d : registry.all()) {
            Optional<Reading> last = store.latest(d.getId());
            double w = last.map(Reading::getPowerW).orElse(0.0);
            DeviceStatus status = DeviceStatus.of(w, thresholds.getActiveThresholdW(), thresholds.getStandbyThresholdW());
            if (status == DeviceStatus.ACTIVE) active++;
            total += w;
            rows.add(DevicePower.builder()
                    .deviceId(d.getId())
                    .name(d.getName())
                    .location(d.getLocation())
                    .powerW(Maths.round(w, 1))
                    .status(status)
                    .lastSeen(last.map(Reading::getTimestamp).orElse(null))
                    .build());
        }
        double rate = tariff.rateAt(now);
        double daily = total / 1000.0 * 24 * rate;
        return PowerSummary.builder()
                .generatedAt(now)
                .totalPowerW(Maths.round(total, 1))
                .activeDevices(active)
                .currentRate(rate)
                .projectedDailyCost(Maths.round(daily, 2))
                .projectedMonthlyCost(Maths.round(daily * DAYS_PER_MONTH, 2))
                .currency(tariff.currency())
                .devices(rows)
                .build();
    }

    /** Calendar day in the monitor's zone. */
    public DailyReport daily(LocalDate date) {
        ZoneId zone = clock.getZone();
        TimeRange day = new TimeRange(date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant());
        Totals t = totals(day);
        return DailyReport.builder()
                .date(date)
                .energyKwh(Maths.round(t.energyWh / 1000.0, 3))
                .cost(Maths.round(t.cost, 2))
                .peakPowerW(Maths.round(t.peakW, 1))
                .averagePowerW(Maths.round(t.meanPowerSum, 1))
                .readings(t.readings)
                .currency(tariff.currency())
                .topConsumers(top(t.consumers, DAILY_TOP))
                .build();
    }

    /** Month to date (or the whole month when it is over), projected to a 30-day month. */
    public MonthlySummary monthly(YearMonth month) {
        ZoneId zone = clock.getZone();
        Instant now = clock.instant();
        Instant from = month.atDay(1).atStartOfDay(zone).toInstant();
        Instant end = month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
        Instant to = now.isBefore(end) && now.isAfter(from) ? now : end;
        Totals t = totals(new TimeRange(from, to));

        int daysElapsed = YearMonth.from(now.atZone(zone)).equals(month)
                ? now.atZone(zone).getDayOfMonth()
                : month.lengthOfMonth();
        double kwh = t.energyWh / 1000.0;
        double perDay = daysElapsed == 0 ? 0.0 : kwh / daysElapsed;
        double costPerDay = daysElapsed == 0 ? 0.0 : t.cost / daysElapsed;
        return MonthlySummary.builder()
                .month(month)
                .daysElapsed(daysElapsed)
                .energyKwh(Maths.round(kwh, 3))
                .cost(Maths.round(t.cost, 2))
                .peakPowerW(Maths.round(t.peakW, 1))
                .averageDailyKwh(Maths.round(perDay, 3))
                .activeDevices(t.devicesWithData)
                .projectedKwh(Maths.round(perDay * DAYS_PER_MONTH, 1))
                .projectedCost(Maths.round(costPerDay * DAYS_PER_MONTH, 2))
                .currency(tariff.currency())
                .topConsumers(top(t.consumers, MONTHLY_TOP))
                .build();
    }

    // ---------------------- internals ----------------------

    private static final class Totals {
        double energyWh;
        double cost;
        double peakW;
        double meanPowerSum;
        int readings;
        int devicesWithData;
        final List<Consumer> consumers = new ArrayList<>();
    }

    private Totals totals(TimeRange range) {
        Totals t = new Totals();
        for (Device d : registry.all()) {
            double wh = 0.0;
            double cost = 0.0;
            double power = 0.0;
            int n = 0;
            for (Reading r : store.query(d.getId(), range)) {
                wh += r.getEnergyWh();
                cost += r.getCost();
                t.peakW = Math.max(t.peakW, r.getPowerW());
                power += r.getPowerW();
                n++;
            }
            if (n == 0) continue;
            t.readings += n;
            t.devicesWithData++;
            t.meanPowerSum += power / n;
            t.energyWh += wh;
            t.cost += cost;
            t.consumers.add(Consumer.builder()
                    .deviceId(d.getId())
                    .name(d.getName())
                    .energyKwh(Maths.round(wh / 1000.0, 3))
                    .cost(Maths.round(cost, 4))
                    .build());
        }
        return t;
    }

    private static List<Consumer> top(List<Consumer> all, int n) {
        return all.stream()
                .sorted(Comparator.comparingDouble(Consumer::getCost).reversed()
                        .thenComparing(Consumer::getDeviceId))
                .limit(n)
                .toList();
    }
}
