package com.elssolution.energymonitor.domain;

/** Appliance kind; drives the simulated load profile and some insight wording. */
public enum DeviceType {
    FRIDGE,
    TV,
    MICROWAVE,
    AC,
    COMPUTER,
    WASHER,
    DRYER,
    GENERIC
}
