package com.elssolution.energymonitor.service;

import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.config.MonitorProperties;
import com.elssolution.energymonitor.domain.DeviceType;
import com.elssolution.energymonitor.domain.RawSample;
import com.elssolution.energymonitor.sensor.ReadFaultException;
import com.elssolution.energymonitor.sensor.SensorSource;
import com.elssolution.energymonitor.sensor.SensorSources;
import com.elssolution.energymonitor.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class CalibratorTest {

    private SensorSource source;
    private DeviceRegistry registry;
    private Calibrator calibrator;

    @BeforeEach
    void setUp() {
        MonitorProperties props = Fixtures.props();
        props.getCalibration().setSamples(4);
        props.getDevices().put("lamp", Fixtures.device(DeviceType.GENERIC, 0, 500));
        MonitorProperties.DeviceProperties heater = Fixtures.device(DeviceType.GENERIC, 1, 3000);
        heater.setCtRatio(2.0);
        heater.setVoltage(120.0);
        props.getDevices().put("heater", heater);

        source = mock(SensorSource.class);
        registry = new DeviceRegistry(props);
        calibrator = new Calibrator(registry, new SensorSources(Map.of("lamp", source, "heater", source)), props);
    }

    @Test
    void mean_two_against_two_hundred_watts_gives_one_hundred() throws Exception {
        assertThat(Calibrator.scaleFromSamples(new double[]{1.9, 2.1, 2.0, 2.0}, 200.0, 1e-3))
                .isCloseTo(100.0, within(1e-9));
    }

    @Test
    void calibrate_stores_the_factor_on_the_device() throws Exception {
        when(source.read(anyInt())).thenReturn(new RawSample(0, 2.0, 0L));

        Calibrator.Result r = calibrator.calibrate("lamp", 200.0);

        assertThat(r.getScale()).isCloseTo(100.0, within(1e-9));
        assertThat(r.getFactor()).isCloseTo(100.0, within(1e-9));
        assertThat(r.getPreviousFactor()).isEqualTo(1.0);
        assertThat(registry.require("lamp").getCalibrationFactor()).isCloseTo(100.0, within(1e-9));
        verify(source, times(4)).read(0);
    }

    @Test
    void factor_accounts_for_ct_ratio_and_voltage() throws Exception {
        when(source.read(anyInt())).thenReturn(new RawSample(1, 2.0, 0L));

        Calibrator.Result r = calibrator.calibrate("heater", 200.0);

        // the reference still reads 100 W per raw unit; ct 2 at 120 V accounts for 240 of it
        assertThat(r.getScale()).isCloseTo(100.0, within(1e-9));
        assertThat(r.getMeanRaw()).isEqualTo(2.0);
        assertThat(r.getFactor()).isCloseTo(100.0 / 240.0, within(1e-12));
        assertThat(new EnergyCalculator().power(2.0, registry.require("heater"))).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void zero_signal_fails_and_keeps_previous_factor() throws Exception {
        when(source.read(anyInt())).thenReturn(new RawSample(0, 0.0, 0L));

        assertThatThrownBy(() -> calibrator.calibrate("lamp", 200.0))
                .isInstanceOf(CalibrationException.class)
                .hasMessageContaining("disconnected");
        assertThat(registry.require("lamp").getCalibrationFactor()).isEqualTo(1.0);
    }

    @Test
    void negative_signal_is_rejected() {
        assertThatThrownBy(() -> Calibrator.scaleFromSamples(new double[]{-2.0, -2.0}, 200.0, 1e-3))
                .isInstanceOf(CalibrationException.class);
    }

    @Test
    void sensor_fault_surfaces_as_calibration_error() throws Exception {
        when(source.read(anyInt())).thenThrow(new ReadFaultException("port gone"));

        assertThatThrownBy(() -> calibrator.calibrate("lamp", 200.0))
                .isInstanceOf(CalibrationException.class)
                .hasCauseInstanceOf(ReadFaultException.class);
        assertThat(registry.require("lamp").getCalibrationFactor()).isEqualTo(1.0);
    }

    @Test
    void known_watts_must_be_positive() {
        assertThatThrownBy(() -> Calibrator.scaleFromSamples(new double[]{2.0}, 0.0, 1e-3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknown_device_is_rejected() {
        assertThatThrownBy(() -> calibrator.calibrate("nope", 100.0))
                .isInstanceOf(DeviceRegistry.UnknownDeviceException.class);
    }
}
