package com.elssolution.energymonitor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Insight category with its static setup effort; lower effort ranks first when savings tie.
 */
public enum InsightCategory {
    USAGE_PATTERN(1),
    COST(2),
    EFFICIENCY(3),
    MAINTENANCE(4),
    ENVIRONMENTAL(5);

    private final int setupEffort;

    InsightCategory(int setupEffort) {
        this.setupEffort = setupEffort;
    }

    public int setupEffort() {
        return setupEffort;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
