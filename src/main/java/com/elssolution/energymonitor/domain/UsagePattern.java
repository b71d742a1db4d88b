package com.elssolution.energymonitor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UsagePattern {
    ALWAYS_ON,
    INTERMITTENT,
    PEAK_ONLY,
    /** Rarely on and never close to its rated load. */
    IDLE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
