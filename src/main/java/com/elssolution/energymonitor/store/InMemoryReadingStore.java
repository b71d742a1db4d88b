package com.elssolution.energymonitor.store;

import com.elssolution.energymonitor.domain.AggregateFn;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.ReadingField;
import com.elssolution.energymonitor.domain.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Skip-list backed store. Writers are serialized; readers iterate live sub-map views and
 * never block appends. Readings are immutable so a reader never sees a half-written one.
 */
@Slf4j
public class InMemoryReadingStore implements ReadingStore {

    /** Equal timestamps keep arrival order through the sequence number. */
    private record Key(Instant ts, long seq) {}

    private static final Comparator<Key> ORDER =
            Comparator.comparing(Key::ts).thenComparingLong(Key::seq);

    private final Map<String, ConcurrentSkipListMap<Key, Reading>> byDevice = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();
    private final Object writeLock = new Object();

    @Override
    public void append(Reading r) {
        if (r == null || r.getDeviceId() == null || r.getTimestamp() == null) {
            throw new StoreWriteException("reading, device id and timestamp are required");
        }
        synchronized (writeLock) {
            ensureAppendable(r);
            byDevice.computeIfAbsent(r.getDeviceId(), k -> new ConcurrentSkipListMap<>(ORDER))
                    .put(new Key(r.getTimestamp(), seq.incrementAndGet()), r);
        }
    }

    /** Throws when {@code r} would break per-device ordering. */
    void ensureAppendable(Reading r) {
        ConcurrentSkipListMap<Key, Reading> m = byDevice.get(r.getDeviceId());
        if (m == null || m.isEmpty()) return;
        Instant last = m.lastKey().ts();
        if (r.getTimestamp().isBefore(last)) {
            throw new StoreWriteException("out-of-order reading for " + r.getDeviceId()
                    + ": " + r.getTimestamp() + " < " + last);
        }
    }

    @Override
    public Iterable<Reading> query(String deviceId, TimeRange range) {
        return () -> slice(deviceId, range).values().iterator();
    }

    private NavigableMap<Key, Reading> slice(String deviceId, TimeRange range) {
        ConcurrentSkipListMap<Key, Reading> m = byDevice.get(deviceId);
        if (m == null) return Collections.emptyNavigableMap();
        return m.subMap(new Key(range.from(), Long.MIN_VALUE), true, new Key(range.to(), Long.MIN_VALUE), false);
    }

    @Override
    public double aggregate(String deviceId, TimeRange range, AggregateFn fn, ReadingField field) {
        long n = 0;
        double sum = 0.0;
        double max = 0.0;
        // Welford: running mean and sum of squared deviations
        double mean = 0.0;
        double m2 = 0.0;
        for (Reading r : query(deviceId, range)) {
            double v = field.of(r);
            if (n == 0 || v > max) max = v;
            sum += v;
            n++;
            double delta = v - mean;
            mean += delta / n;
            m2 += delta * (v - mean);
        }
        if (n == 0) return 0.0;
        return switch (fn) {
            case SUM -> sum;
            case MAX -> max;
            case MEAN -> sum / n;
            // population std-dev, same as Maths.stdev
            case STDEV -> n < 2 ? 0.0 : Math.sqrt(Math.max(0.0, m2 / n));
        };
    }

    @Override
    public Optional<Reading> latest(String deviceId) {
        ConcurrentSkipListMap<Key, Reading> m = byDevice.get(deviceId);
        if (m == null) return Optional.empty();
        Map.Entry<Key, Reading> e = m.lastEntry();
        return e == null ? Optional.empty() : Optional.of(e.getValue());
    }

    @Override
    public Set<String> deviceIds() {
        return Set.copyOf(byDevice.keySet());
    }
}
