package com.elssolution.energymonitor.web;

import com.elssolution.energymonitor.alerts.AlertService;
import com.elssolution.energymonitor.service.CollectorService;
import com.elssolution.energymonitor.service.UsageReportService;
import lombok.Builder;
import lombok.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

@RestController
public class StatusController {

    @Value @Builder
    public static class StatusView {
        CollectorService.CollectorView collector;
        UsageReportService.PowerSummary power;
        int activeAlerts;
    }

    private final AlertService alerts;
    private final CollectorService collector;
    private final UsageReportService reports;
    private final Clock clock;

    public StatusController(AlertService alerts, CollectorService collector, UsageReportService reports, Clock clock) {
        this.alerts = alerts;
        this.collector = collector;
        this.reports = reports;
        this.clock = clock;
    }

    @GetMapping("/status")
    public StatusView getStatus() {
        return StatusView.builder()
                .collector(collector.view())
                .power(reports.currentPower())
                .activeAlerts(alerts.snapshot().getActive().size())
                .build();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    @PostMapping("/collector/start")
    public CollectorService.CollectorView startCollector() {
        collector.start();
        return collector.view();
    }

    @PostMapping("/collector/stop")
    public CollectorService.CollectorView stopCollector() {
        collector.stop();
        return collector.view();
    }

    @GetMapping("/reports/power")
    public UsageReportService.PowerSummary powerReport() {
        return reports.currentPower();
    }

    /** Defaults to yesterday, as the daily report covers a finished day. */
    @GetMapping("/reports/daily")
    public UsageReportService.DailyReport dailyReport(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return reports.daily(date != null ? date : LocalDate.now(clock).minusDays(1));
    }

    @GetMapping("/reports/monthly")
    public UsageReportService.MonthlySummary monthlyReport(
            @RequestParam(name = "month", required = false) @DateTimeFormat(pattern = "yyyy-MM") YearMonth month) {
        return reports.monthly(month != null ? month : YearMonth.now(clock));
    }
}
