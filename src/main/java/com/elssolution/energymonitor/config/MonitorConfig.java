package com.elssolution.energymonitor.config;

import com.elssolution.energymonitor.analysis.CachingInsightProducer;
import com.elssolution.energymonitor.analysis.InsightProducer;
import com.elssolution.energymonitor.analysis.RuleBasedAnalyzer;
import com.elssolution.energymonitor.integration.adc.AdcTransport;
import com.elssolution.energymonitor.integration.adc.SerialAdcSensorSource;
import com.elssolution.energymonitor.integration.adc.SerialPortAdcTransport;
import com.elssolution.energymonitor.sensor.SensorSources;
import com.elssolution.energymonitor.service.TariffService;
import com.elssolution.energymonitor.store.InMemoryReadingStore;
import com.elssolution.energymonitor.store.JournalReadingStore;
import com.elssolution.energymonitor.store.ReadingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the pipeline from {@link MonitorProperties}: devices, sensor sources, store and analyzer.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

    @Bean
    public Clock clock(MonitorProperties props) {
        String zone = props.getZone();
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }

    @Bean
    public DeviceRegistry deviceRegistry(MonitorProperties props) {
        return new DeviceRegistry(props);
    }

    /** Opens the port only on first use, so simulated setups never touch serial hardware. */
    @Bean(destroyMethod = "close")
    public AdcTransport adcTransport(MonitorProperties props) {
        return new SerialPortAdcTransport(props.getSensor().getSerial());
    }

    @Bean
    public SensorSources sensorSources(DeviceRegistry registry, AdcTransport adc, MonitorProperties props, Clock clock) {
        MonitorProperties.Serial serial = props.getSensor().getSerial();
        return new SensorSources(registry,
                () -> new SerialAdcSensorSource(adc, serial.getVref(), serial.getFullScale(), clock),
                clock);
    }

    @Bean
    public ReadingStore readingStore(MonitorProperties props) {
        String path = props.getStore().getJournalPath();
        if (path == null || path.isBlank()) {
            log.info("reading_store mode=memory");
            return new InMemoryReadingStore();
        }
        try {
            return new JournalReadingStore(Path.of(path));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open reading journal " + path, e);
        }
    }

    @Bean
    public InsightProducer insightProducer(ReadingStore store, DeviceRegistry registry, TariffService tariff,
                                           MonitorProperties props, Clock clock) {
        MonitorProperties.Analysis cfg = props.getAnalysis();
        return new CachingInsightProducer(
                new RuleBasedAnalyzer(store, registry, tariff, props, clock),
                cfg.getCacheTtl(), cfg.getCacheMaxEntries(), clock);
    }
}
