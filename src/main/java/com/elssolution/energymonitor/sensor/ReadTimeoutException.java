package com.elssolution.energymonitor.sensor;

public class ReadTimeoutException extends SensorException {

    public ReadTimeoutException(String message) {
        super(message);
    }

    public ReadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
