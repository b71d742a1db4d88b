package com.elssolution.energymonitor.domain;

import java.time.Duration;
import java.time.Instant;

/** Half-open interval [from, to). */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        if (from == null || to == null) throw new IllegalArgumentException("range bounds are required");
        if (to.isBefore(from)) throw new IllegalArgumentException("range end before start: " + from + " > " + to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
