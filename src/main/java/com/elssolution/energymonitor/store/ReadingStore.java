package com.elssolution.energymonitor.store;

import com.elssolution.energymonitor.domain.AggregateFn;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.ReadingField;
import com.elssolution.energymonitor.domain.TimeRange;

import java.util.Optional;
import java.util.Set;

/**
 * Append-only, per-device time-ordered reading repository.
 * One writer (the collector); any number of concurrent readers.
 */
public interface ReadingStore {

    /**
     * Appends a reading. Timestamps per device must be non-decreasing.
     *
     * @throws StoreWriteException when the reading could not be persisted or is out of order
     */
    void append(Reading reading);

    /**
     * Readings of {@code deviceId} inside {@code range}, ascending by timestamp.
     * Lazy: nothing is copied up front. Each {@code iterator()} call starts over.
     */
    Iterable<Reading> query(String deviceId, TimeRange range);

    /**
     * Aggregate over one field of the readings in range. Energy and cost are already per-interval
     * increments, so {@code SUM} of them is the window total. Empty range yields 0.
     */
    double aggregate(String deviceId, TimeRange range, AggregateFn fn, ReadingField field);

    default double aggregate(String deviceId, TimeRange range, AggregateFn fn) {
        return aggregate(deviceId, range, fn, ReadingField.POWER_W);
    }

    Optional<Reading> latest(String deviceId);

    Set<String> deviceIds();
}
