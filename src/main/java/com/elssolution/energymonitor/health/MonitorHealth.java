package com.elssolution.energymonitor.health;

import com.elssolution.energymonitor.service.CollectorService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** UP while the collector runs and its last tick is no older than three periods. */
@Component
public class MonitorHealth implements HealthIndicator {
    private final CollectorService collector;
    private final Clock clock;

    public MonitorHealth(CollectorService collector, Clock clock) {
        this.collector = collector;
        this.clock = clock;
    }

    @Override public Health health() {
        CollectorService.State state = collector.getState();
        var last = collector.getLastTick();
        long ageMs = last.map(t -> Duration.between(t.getStartedAt(), clock.instant()).toMillis()).orElse(-1L);
        boolean fresh = ageMs >= 0 && ageMs <= collector.getPeriod().multipliedBy(3).toMillis();
        boolean ok = state == CollectorService.State.RUNNING && fresh;

        return (ok ? Health.up() : Health.down())
                .withDetail("state", state)
                .withDetail("lastTickAgeMs", ageMs)
                .withDetail("lastTickOk", last.map(CollectorService.TickSummary::getOk).orElse(0))
                .withDetail("lastTickFailed", last.map(CollectorService.TickSummary::getFailed).orElse(0))
                .withDetail("lastTickAt", last.map(CollectorService.TickSummary::getStartedAt).map(Instant::toString).orElse("-"))
                .build();
    }
}
