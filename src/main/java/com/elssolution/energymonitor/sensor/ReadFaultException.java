package com.elssolution.energymonitor.sensor;

public class ReadFaultException extends SensorException {

    public ReadFaultException(String message) {
        super(message);
    }

    public ReadFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
