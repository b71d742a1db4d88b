package com.elssolution.energymonitor.service;

/** Calibration could not derive a factor; the device keeps the one it had. */
public class CalibrationException extends Exception {

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
