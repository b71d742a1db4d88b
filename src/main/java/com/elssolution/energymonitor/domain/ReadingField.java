package com.elssolution.energymonitor.domain;

import java.util.function.ToDoubleFunction;

/** Numeric column of a {@link Reading} that an aggregate runs over. */
public enum ReadingField {
    POWER_W(Reading::getPowerW),
    ENERGY_WH(Reading::getEnergyWh),
    COST(Reading::getCost),
    RAW(Reading::getRawValue);

    private final ToDoubleFunction<Reading> extractor;

    ReadingField(ToDoubleFunction<Reading> extractor) {
        this.extractor = extractor;
    }

    public double of(Reading r) {
        return extractor.applyAsDouble(r);
    }
}
