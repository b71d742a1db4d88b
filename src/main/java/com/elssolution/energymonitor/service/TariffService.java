package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.config.MonitorProperties.HourWindow;
import com.elssolution.energymonitor.config.MonitorProperties.Season;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Price of a kWh at a given instant. Flat unless time-of-use is enabled, in which case the
 * weekday/weekend peak windows win over the off-peak window and everything else is mid-peak.
 */
@Slf4j
@Service
public class TariffService {

    public enum Period { PEAK, MID_PEAK, OFF_PEAK, FLAT }

    private final MonitorProperties.Tariff tariff;
    private final ZoneId zone;

    public TariffService(MonitorProperties props, Clock clock) {
        this.tariff = props.getTariff();
        this.zone = clock.getZone();
        log.info("tariff_loaded flat={} tou={} currency={}",
                tariff.getRatePerKwh(), tariff.getTimeOfUse().isEnabled(), tariff.getCurrency());
    }

    public boolean isTimeOfUse() {
        return tariff.getTimeOfUse().isEnabled();
    }

    public String currency() {
        return tariff.getCurrency();
    }

    public double flatRate() {
        return tariff.getRatePerKwh();
    }

    public Period periodAt(Instant at) {
        MonitorProperties.TimeOfUse tou = tariff.getTimeOfUse();
        if (!tou.isEnabled()) return Period.FLAT;
        ZonedDateTime t = at.atZone(zone);
        LocalTime time = t.toLocalTime();
        List<HourWindow> peak = isWeekend(t.getDayOfWeek()) ? tou.getWeekendPeak() : tou.getWeekdayPeak();
        if (peak != null && peak.stream().anyMatch(w -> w.contains(time))) return Period.PEAK;
        if (tou.getOffPeak() != null && tou.getOffPeak().contains(time)) return Period.OFF_PEAK;
        return Period.MID_PEAK;
    }

    /** Currency per kWh at {@code at}, seasonal multiplier included. */
    public double rateAt(Instant at) {
        Period p = periodAt(at);
        if (p == Period.FLAT) return tariff.getRatePerKwh();
        MonitorProperties.TimeOfUse tou = tariff.getTimeOfUse();
        double base = switch (p) {
            case PEAK -> tou.getPeakRate();
            case OFF_PEAK -> tou.getOffPeakRate();
            default -> tou.getMidPeakRate();
        };
        return base * seasonalMultiplier(at);
    }

    /** Peak minus off-peak rate at {@code at}; 0 on a flat tariff. */
    public double peakSpread(Instant at) {
        if (!isTimeOfUse()) return 0.0;
        MonitorProperties.TimeOfUse tou = tariff.getTimeOfUse();
        return Math.max(0.0, tou.getPeakRate() - tou.getOffPeakRate()) * seasonalMultiplier(at);
    }

    private double seasonalMultiplier(Instant at) {
        Season s = Season.of(at.atZone(zone).getMonth());
        Double m = tariff.getTimeOfUse().getSeasonalMultipliers().get(s);
        return m == null ? 1.0 : m;
    }

    private static boolean isWeekend(DayOfWeek d) {
        return d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY;
    }
}
