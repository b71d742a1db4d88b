package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.alerts.AlertService;
import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.Device;
import com.elssolution.energymonitor.domain.RawSample;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.sensor.ReadTimeoutException;
import com.elssolution.energymonitor.sensor.SensorException;
import com.elssolution.energymonitor.sensor.SensorSource;
import com.elssolution.energymonitor.sensor.SensorSources;
import com.elssolution.energymonitor.store.ReadingStore;
import com.elssolution.energymonitor.store.StoreWriteException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The polling loop. One timer tick polls every due device on a bounded worker pool:
 * read (with bounded retries), convert, integrate against the last stored reading, append.
 *
 * <p>A device that fails is skipped for the tick; nothing it does can abort or delay the
 * other devices beyond its own deadline.
 *
 * <pre>
 *   IDLE --start()--> RUNNING --stop()--> STOPPING --(in-flight tick done)--> IDLE
 * </pre>
 */
@Slf4j
@Service
public class CollectorService {

    public enum State { IDLE, RUNNING, STOPPING }

    public enum Outcome { OK, FAILED, DROPPED, SKIPPED }

    public static final String READ_FAILED_ALERT = "DEVICE_READ_FAILED:";
    public static final String STORE_DROPPED_ALERT = "STORE_WRITE_DROPPED";
    public static final String OVERRUN_ALERT = "COLLECTOR_TICK_OVERRUN";

    private static final int STORE_ATTEMPTS = 2; // first try + one retry

    @Value @Builder
    public static class TickSummary {
        Instant startedAt;
        long durationMs;
        int polled;
        int ok;
        int failed;
        int dropped;
        int skipped;
        Map<String, Outcome> outcomes;
    }

    @Value @Builder
    public static class CollectorView {
        State state;
        long periodMs;
        int devices;
        long ticks;
        TickSummary lastTick;
    }

    // ---- collaborators ----
    private final MonitorProperties.Collector cfg;
    private final DeviceRegistry registry;
    private final SensorSources sources;
    private final EnergyCalculator energy;
    private final TariffService tariff;
    private final ReadingStore store;
    private final AlertService alerts;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Clock clock;

    // ---- state ----
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final ReentrantLock tickLock = new ReentrantLock();
    private final Duration period;
    private final Map<String, Reading> lastStored = new ConcurrentHashMap<>();
    private final Map<String, Instant> nextDue = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicReference<TickSummary> lastTick = new AtomicReference<>();
    private volatile long ticks = 0;
    private volatile ScheduledFuture<?> loopHandle;
    private volatile ScheduledFuture<?> summaryHandle;

    public CollectorService(MonitorProperties props,
                            DeviceRegistry registry,
                            SensorSources sources,
                            EnergyCalculator energy,
                            TariffService tariff,
                            ReadingStore store,
                            AlertService alerts,
                            ScheduledExecutorService scheduler,
                            @Qualifier("collectorWorkers") ExecutorService workers,
                            Clock clock) {
        this.cfg = props.getCollector();
        this.registry = registry;
        this.sources = sources;
        this.energy = energy;
        this.tariff = tariff;
        this.store = store;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.workers = workers;
        this.clock = clock;
        this.period = registry.all().stream()
                .map(this::intervalOf)
                .min(Duration::compareTo)
                .orElse(cfg.getPollInterval());
        registry.all().forEach(d -> store.latest(d.getId()).ifPresent(r -> lastStored.put(d.getId(), r)));
    }

    // ---- Lifecycle ----
    @PostConstruct
    void init() {
        long every = Math.max(1, cfg.getSummaryEvery().toMillis());
        summaryHandle = scheduler.scheduleAtFixedRate(this::logSummary, every, every, TimeUnit.MILLISECONDS);
        if (cfg.isAutoStart()) start();
    }

    @PreDestroy
    void shutdown() {
        stop();
        ScheduledFuture<?> h = summaryHandle;
        if (h != null) h.cancel(false);
    }

    /** IDLE to RUNNING. Calling it while already running (or stopping) does nothing. */
    public void start() {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            log.debug("collector_start_ignored state={}", state.get());
            return;
        }
        loopHandle = scheduler.scheduleAtFixedRate(this::scheduledTick, 0, period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("collector_started period={}ms devices={} workersCap={}",
                period.toMillis(), registry.size(), cfg.getMaxWorkers());
    }

    /** RUNNING to STOPPING; waits for the in-flight tick, then IDLE. No tick runs after this returns. */
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) return;
        ScheduledFuture<?> h = loopHandle;
        if (h != null) h.cancel(false);
        tickLock.lock();
        try {
            loopHandle = null;
            state.set(State.IDLE);
        } finally {
            tickLock.unlock();
        }
        log.info("collector_stopped ticks={}", ticks);
    }

    public State getState() {
        return state.get();
    }

    public Duration getPeriod() {
        return period;
    }

    public Optional<TickSummary> getLastTick() {
        return Optional.ofNullable(lastTick.get());
    }

    public CollectorView view() {
        return CollectorView.builder()
                .state(state.get())
                .periodMs(period.toMillis())
                .devices(registry.size())
                .ticks(ticks)
                .lastTick(lastTick.get())
                .build();
    }

    // ---- Tick ----
    private void scheduledTick() {
        tickLock.lock();
        try {
            if (state.get() != State.RUNNING) return;
            runTickLocked();
        } catch (RuntimeException e) {
            // a throw here would silently cancel the periodic task
            log.error("collector_tick_failed err={}", e.toString(), e);
        } finally {
            tickLock.unlock();
        }
    }

    /** Runs one tick now, whatever the state. Serialized with scheduled ticks. */
    public TickSummary runTick() {
        tickLock.lock();
        try {
            return runTickLocked();
        } finally {
            tickLock.unlock();
        }
    }

    private TickSummary runTickLocked() {
        Instant startedAt = clock.instant();
        long t0 = System.nanoTime();
        long budgetNanos = perDeviceBudget().toNanos();

        Map<String, Outcome> outcomes = new LinkedHashMap<>();
        Map<String, Future<Outcome>> futures = new LinkedHashMap<>();
        for (Device d : registry.all()) {
            if (!isDue(d, startedAt)) continue;
            if (!inFlight.add(d.getId())) {
                log.warn("device_still_busy device={} skipping tick", d.getId());
                outcomes.put(d.getId(), Outcome.SKIPPED);
                continue;
            }
            try {
                futures.put(d.getId(), workers.submit(() -> pollDevice(d)));
            } catch (RejectedExecutionException e) {
                inFlight.remove(d.getId());
                log.warn("device_poll_rejected device={} err={}", d.getId(), e.toString());
                outcomes.put(d.getId(), Outcome.SKIPPED);
            }
        }

        boolean interrupted = false;
        for (Map.Entry<String, Future<Outcome>> e : futures.entrySet()) {
            String id = e.getKey();
            Future<Outcome> f = e.getValue();
            if (interrupted) {
                f.cancel(true);
                outcomes.put(id, Outcome.SKIPPED);
                continue;
            }
            long remaining = budgetNanos - (System.nanoTime() - t0);
            try {
                outcomes.put(id, f.get(Math.max(0, remaining), TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                f.cancel(true);
                log.warn("device_poll_deadline device={} budget={}ms", id, TimeUnit.NANOSECONDS.toMillis(budgetNanos));
                alerts.raise(READ_FAILED_ALERT + id, "poll exceeded its deadline", AlertService.Severity.WARN);
                outcomes.put(id, Outcome.FAILED);
            } catch (ExecutionException ex) {
                log.error("device_poll_crashed device={} err={}", id, String.valueOf(ex.getCause()), ex.getCause());
                alerts.raise(READ_FAILED_ALERT + id, String.valueOf(ex.getCause()), AlertService.Severity.ERROR);
                outcomes.put(id, Outcome.FAILED);
            } catch (CancellationException ex) {
                outcomes.put(id, Outcome.SKIPPED);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                interrupted = true;
                f.cancel(true);
                outcomes.put(id, Outcome.SKIPPED);
            }
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        TickSummary summary = summarize(startedAt, durationMs, outcomes);
        lastTick.set(summary);
        ticks++;

        if (durationMs > period.toMillis()) {
            alerts.raise(OVERRUN_ALERT, "tick took " + durationMs + "ms, period " + period.toMillis() + "ms",
                    AlertService.Severity.WARN);
        } else {
            alerts.resolve(OVERRUN_ALERT);
        }
        log.debug("collector_tick polled={} ok={} failed={} dropped={} took={}ms",
                summary.getPolled(), summary.getOk(), summary.getFailed(), summary.getDropped(), durationMs);
        return summary;
    }

    // ---- Per-device pipeline ----
    private Outcome pollDevice(Device d) {
        String id = d.getId();
        try {
            RawSample sample;
            try {
                sample = readWithRetry(d);
            } catch (SensorException e) {
                log.warn("device_read_failed device={} attempts={} err={}", id, cfg.getMaxAttempts(), e.toString());
                alerts.raise(READ_FAILED_ALERT + id, e.getMessage(), AlertService.Severity.WARN);
                return Outcome.FAILED;
            }
            alerts.resolve(READ_FAILED_ALERT + id);

            Instant ts = Instant.ofEpochMilli(sample.sampledAt());
            Reading reading = energy.integrate(d, sample, lastStored.get(id), tariff.rateAt(ts));
            if (!appendWithRetry(reading)) return Outcome.DROPPED;
            lastStored.put(id, reading);
            return Outcome.OK;
        } finally {
            inFlight.remove(id);
        }
    }

    private RawSample readWithRetry(Device d) throws SensorException {
        SensorSource source = sources.forDevice(d.getId());
        int attempts = Math.max(1, cfg.getMaxAttempts());
        long backoff = cfg.getInitialBackoff().toMillis();
        SensorException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                log.info("device_read_retry device={} attempt={} backoff={}ms", d.getId(), attempt, backoff);
                sleepBackoff(backoff);
                backoff *= 2;
            }
            try {
                return source.read(d.getChannel());
            } catch (SensorException e) {
                last = e;
                log.debug("device_read_attempt_failed device={} attempt={} err={}", d.getId(), attempt, e.toString());
            }
        }
        throw last;
    }

    private boolean appendWithRetry(Reading r) {
        StoreWriteException last = null;
        for (int attempt = 1; attempt <= STORE_ATTEMPTS; attempt++) {
            try {
                store.append(r);
                alerts.resolve(STORE_DROPPED_ALERT);
                return true;
            } catch (StoreWriteException e) {
                last = e;
                log.debug("store_write_failed device={} attempt={} err={}", r.getDeviceId(), attempt, e.getMessage());
            }
        }
        log.warn("reading_dropped device={} ts={} cause={}", r.getDeviceId(), r.getTimestamp(), last.getMessage());
        alerts.raise(STORE_DROPPED_ALERT, r.getDeviceId() + ": " + last.getMessage(), AlertService.Severity.WARN);
        return false;
    }

    private static void sleepBackoff(long ms) throws ReadTimeoutException {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadTimeoutException("interrupted during retry backoff", e);
        }
    }

    // ---- Scheduling helpers ----
    private Duration intervalOf(Device d) {
        return d.getPollingInterval() != null ? d.getPollingInterval() : cfg.getPollInterval();
    }

    /** Devices with a slower interval than the tick are polled only when their slot comes up. */
    private boolean isDue(Device d, Instant now) {
        Duration interval = intervalOf(d);
        Instant due = nextDue.get(d.getId());
        // half a tick of slack so timer jitter does not push a device to the following tick
        if (due != null && now.plus(period.dividedBy(2)).isBefore(due)) return false;
        nextDue.put(d.getId(), now.plus(interval));
        return true;
    }

    /** Worst case for one device: every attempt times out and every backoff is slept. */
    private Duration perDeviceBudget() {
        int attempts = Math.max(1, cfg.getMaxAttempts());
        long backoffTotal = cfg.getInitialBackoff().toMillis() * ((1L << (attempts - 1)) - 1);
        return cfg.getReadTimeout().multipliedBy(attempts).plusMillis(backoffTotal).plusSeconds(1);
    }

    private static TickSummary summarize(Instant startedAt, long durationMs, Map<String, Outcome> outcomes) {
        int ok = 0, failed = 0, dropped = 0, skipped = 0;
        for (Outcome o : outcomes.values()) {
            switch (o) {
                case OK -> ok++;
                case FAILED -> failed++;
                case DROPPED -> dropped++;
                case SKIPPED -> skipped++;
            }
        }
        return TickSummary.builder()
                .startedAt(startedAt)
                .durationMs(durationMs)
                .polled(outcomes.size())
                .ok(ok).failed(failed).dropped(dropped).skipped(skipped)
                .outcomes(Map.copyOf(outcomes))
                .build();
    }

    private void logSummary() {
        try {
            TickSummary t = lastTick.get();
            if (t == null) {
                log.info("collector_summary state={} ticks=0", state.get());
                return;
            }
            log.info("collector_summary state={} ticks={} last={} ok={} failed={} dropped={} took={}ms",
                    state.get(), ticks, t.getStartedAt(), t.getOk(), t.getFailed(), t.getDropped(), t.getDurationMs());
        } catch (Exception e) {
            log.warn("collector_summary_failed err={}", e.toString());
        }
    }
}
