package com.elssolution.energymonitor.sensor;

import com.elssolution.energymonitor.domain.RawSample;

/**
 * Produces one raw sample for a channel. Implementations share no mutable state with each other.
 */
public interface SensorSource {

    /**
     * @throws ReadTimeoutException when the channel did not answer within the source's own timeout
     * @throws ReadFaultException   on any transport or device fault
     */
    RawSample read(int channel) throws ReadTimeoutException, ReadFaultException;

    /** Short label for logs ("serial-adc:/dev/ttyUSB0", "sim:fridge"). */
    String describe();
}
