package com.elssolution.energymonitor.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keyed alert episodes. {@code raise} opens or refreshes an episode, {@code resolve} closes it.
 * Keys used by the collector: {@code DEVICE_READ_FAILED:<id>}, {@code STORE_WRITE_DROPPED},
 * {@code COLLECTOR_TICK_OVERRUN}; the uncaught handler uses {@code UNCAUGHT}.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    // ---- Views returned to callers ----
    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raise() calls in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;          // epoch ms
        String type;      // "RAISE" or "RESOLVE"
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    // ---- state ----
    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;

    // ---- API ----
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k, sev, message, now));

        boolean startingNewEpisode;
        synchronized (a) {
            startingNewEpisode = !a.active || a.count.get() == 0;
            if (startingNewEpisode) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active   = true;
            a.severity = sev;
            a.message  = message;
            a.count.incrementAndGet();
            a.lastSeen = now;
        }

        if (startingNewEpisode) {
            log.warn("alert_raise key={} sev={} msg={}", key, sev, message);
            emitEvent(key, message, sev, "RAISE");
        } else {
            log.debug("alert_refresh key={} count={}", key, a.count.get());
        }
    }

    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        boolean wasActive;
        Severity sevAtResolve;
        synchronized (a) {
            wasActive = a.active;
            sevAtResolve = a.severity;
            a.active  = false;
            a.lastSeen = System.currentTimeMillis();
        }

        if (wasActive) {
            log.info("alert_resolve key={}", key);
            emitEvent(key, "recovered", sevAtResolve, "RESOLVE");
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    /** All active alerts (most recently seen first) and the recent raise/resolve events. */
    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(ma -> ma.active)
                .sorted(Comparator.comparingLong(ma -> -ma.lastSeen))
                .map(MutableAlert::view)
                .toList();

        List<EventView> recentCopy;
        synchronized (recent) {
            recentCopy = new ArrayList<>(recent);
        }
        Collections.reverse(recentCopy);
        return AlertsSnapshot.builder().active(active).recent(recentCopy).build();
    }

    // ---- internals ----
    private void emitEvent(String key, String msg, Severity sev, String type) {
        EventView ev = EventView.builder()
                .key(key).message(msg).severity(sev).type(type)
                .ts(System.currentTimeMillis())
                .build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }

    // ---- per-alert mutable record ----
    private static class MutableAlert {
        final String key;
        volatile String message;
        volatile Severity severity;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger(0);

        MutableAlert(String key, Severity severity, String message, long now) {
            this.key = key;
            this.severity = severity;
            this.message = message;
            this.active = true;
            this.firstSeen = now;
            this.lastSeen = now;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }
    }
}
