package com.elssolution.energymonitor.integration.adc;

import com.elssolution.energymonitor.config.MonitorProperties;
import com.fazecast.jSerialComm.SerialPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Serial link to the ADC bridge. Opens lazily, closes on any I/O error so the next
 * transfer reopens a clean port.
 */
@Slf4j
public class SerialPortAdcTransport implements AdcTransport {

    private final String portName;
    private final int baudRate;
    private final int readTimeoutMs;
    private final int writeTimeoutMs;

    private final Object portLock = new Object();
    private SerialPort serialPort;

    public SerialPortAdcTransport(MonitorProperties.Serial cfg) {
        this.portName = cfg.getPort();
        this.baudRate = cfg.getBaudRate();
        this.readTimeoutMs = cfg.getReadTimeoutMs();
        this.writeTimeoutMs = cfg.getWriteTimeoutMs();
    }

    @Override
    public byte[] transfer(byte[] request, int responseLength) throws IOException {
        synchronized (portLock) {
            try {
                ensureOpen();
                int written = serialPort.writeBytes(request, request.length);
                if (written != request.length) {
                    throw new IOException("short write " + written + "/" + request.length + " on " + portName);
                }
                return readUpTo(serialPort.getInputStream(), responseLength);
            } catch (IOException e) {
                closeQuietly();
                throw e;
            } catch (RuntimeException e) {
                closeQuietly();
                throw new IOException("serial transfer failed on " + portName, e);
            }
        }
    }

    private byte[] readUpTo(InputStream in, int len) throws IOException {
        byte[] buf = new byte[len];
        int got = 0;
        long deadline = System.currentTimeMillis() + Math.max(1, readTimeoutMs);
        while (got < len && System.currentTimeMillis() < deadline) {
            int n = in.read(buf, got, len - got);
            if (n < 0) break;
            got += n;
        }
        return got == len ? buf : Arrays.copyOf(buf, got);
    }

    private void ensureOpen() throws IOException {
        if (serialPort != null && serialPort.isOpen()) return;

        SerialPort p = SerialPort.getCommPort(portName);
        p.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        p.setFlowControl(SerialPort.FLOW_CONTROL_DISABLED);
        // semi-blocking: read() returns as soon as any byte arrives, or after the timeout
        p.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING | SerialPort.TIMEOUT_WRITE_BLOCKING,
                readTimeoutMs, writeTimeoutMs);

        if (!p.openPort()) {
            log.error("adc_port_open_failed port={} baud={}", portName, baudRate);
            throw new IOException("Cannot open serial port: " + portName);
        }
        p.flushIOBuffers();
        serialPort = p;
        log.info("adc_port_opened port={} baud={} rTimeoutMs={} wTimeoutMs={}",
                portName, baudRate, readTimeoutMs, writeTimeoutMs);
    }

    private void closeQuietly() {
        if (serialPort == null) return;
        try {
            if (serialPort.isOpen()) serialPort.closePort();
        } catch (RuntimeException e) {
            log.debug("adc_port_close_error port={} err={}", portName, e.toString());
        } finally {
            serialPort = null;
            log.info("adc_port_closed port={}", portName);
        }
    }

    @Override
    public String name() {
        return portName;
    }

    @Override
    public void close() {
        synchronized (portLock) {
            closeQuietly();
        }
    }
}
