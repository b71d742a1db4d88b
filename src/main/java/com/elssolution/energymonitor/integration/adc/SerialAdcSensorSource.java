package com.elssolution.energymonitor.integration.adc;

import com.elssolution.energymonitor.domain.RawSample;
import com.elssolution.energymonitor.sensor.ReadFaultException;
import com.elssolution.energymonitor.sensor.ReadTimeoutException;
import com.elssolution.energymonitor.sensor.SensorSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;

/**
 * MCP3008-style 10-bit ADC behind a serial bridge. One read = one 3-byte transfer:
 * <pre>
 *   request : 0x01, (8 + channel) &lt;&lt; 4, 0x00
 *   response: ignored, low 2 bits = value[9:8], value[7:0]
 * </pre>
 * The count is scaled to volts at the burden resistor; the bridge firmware reports the
 * RMS of the AC-coupled CT signal.
 */
@Slf4j
public class SerialAdcSensorSource implements SensorSource {

    private static final int FRAME_LEN = 3;
    private static final int MAX_CHANNEL = 7;

    private final AdcTransport transport;
    private final double vref;
    private final int fullScale;
    private final Clock clock;

    public SerialAdcSensorSource(AdcTransport transport, double vref, int fullScale, Clock clock) {
        this.transport = transport;
        this.vref = vref;
        this.fullScale = fullScale;
        this.clock = clock;
    }

    @Override
    public RawSample read(int channel) throws ReadTimeoutException, ReadFaultException {
        if (channel < 0 || channel > MAX_CHANNEL) {
            throw new ReadFaultException("channel out of range: " + channel);
        }
        byte[] request = {0x01, (byte) ((8 + channel) << 4), 0x00};

        byte[] resp;
        try {
            resp = transport.transfer(request, FRAME_LEN);
        } catch (IOException e) {
            throw new ReadFaultException("adc transfer failed on " + transport.name() + " ch=" + channel, e);
        }
        if (resp == null || resp.length < FRAME_LEN) {
            int got = resp == null ? 0 : resp.length;
            throw new ReadTimeoutException("adc response incomplete on " + transport.name()
                    + " ch=" + channel + " (" + got + "/" + FRAME_LEN + " bytes)");
        }

        int counts = ((resp[1] & 0x03) << 8) | (resp[2] & 0xFF);
        double volts = (counts / (double) fullScale) * vref;
        if (log.isTraceEnabled()) log.trace("adc_read ch={} counts={} volts={}", channel, counts, volts);
        return new RawSample(channel, volts, clock.millis());
    }

    @Override
    public String describe() {
        return "serial-adc:" + transport.name();
    }
}
