package com.elssolution.energymonitor.domain;

public enum AggregateFn {
    MEAN,
    MAX,
    SUM,
    STDEV
}
