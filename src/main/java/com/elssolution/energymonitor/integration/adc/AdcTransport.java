package com.elssolution.energymonitor.integration.adc;

import java.io.IOException;

/**
 * One request/response exchange with the ADC bridge.
 */
public interface AdcTransport extends AutoCloseable {

    /**
     * Writes {@code request} and reads up to {@code responseLength} bytes.
     * May return fewer bytes when the read timeout expired first.
     */
    byte[] transfer(byte[] request, int responseLength) throws IOException;

    String name();

    @Override
    void close();
}
