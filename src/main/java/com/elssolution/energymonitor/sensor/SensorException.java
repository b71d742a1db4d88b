package com.elssolution.energymonitor.sensor;

/** Transient, per-device read failure. */
public abstract class SensorException extends Exception {

    protected SensorException(String message) {
        super(message);
    }

    protected SensorException(String message, Throwable cause) {
        super(message, cause);
    }
}
