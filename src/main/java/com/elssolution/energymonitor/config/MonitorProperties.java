package com.elssolution.energymonitor.config;

import com.elssolution.energymonitor.domain.DeviceType;
import com.elssolution.energymonitor.domain.SourceKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.time.Month;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code monitor.*}. Bound once at startup and handed to the components
 * that need it through their constructors.
 */
@Data
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /** Zone for time-of-day logic (tariff windows, usage hours, peak hour). Empty = system default. */
    private String zone = "";

    private Sensor sensor = new Sensor();
    private Collector collector = new Collector();
    private Calibration calibration = new Calibration();
    private Tariff tariff = new Tariff();
    private Analysis analysis = new Analysis();
    private Store store = new Store();

    /** Device table keyed by device id; insertion order is kept. */
    private Map<String, DeviceProperties> devices = new LinkedHashMap<>();

    @Data
    public static class Sensor {
        /** Default source for devices that don't name one. */
        private SourceKind mode = SourceKind.SIMULATED;
        private Serial serial = new Serial();
    }

    @Data
    public static class Serial {
        private String port = "/dev/ttyUSB0";
        private int baudRate = 115200;
        private int readTimeoutMs = 1000;
        private int writeTimeoutMs = 1000;
        /** ADC reference voltage (V). */
        private double vref = 3.3;
        /** Full-scale count of the ADC (10-bit = 1023). */
        private int fullScale = 1023;
    }

    @Data
    public static class Collector {
        private Duration pollInterval = Duration.ofSeconds(60);
        /** Upper bound for one read attempt of one device. */
        private Duration readTimeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        /** Delay after the first failed attempt; doubled after each further one. */
        private Duration initialBackoff = Duration.ofSeconds(1);
        /** Cap for the per-tick worker pool (actual size = min(devices, this)). */
        private int maxWorkers = 8;
        private boolean autoStart = true;
        /** How often the collector logs its last-tick summary. */
        private Duration summaryEvery = Duration.ofMinutes(5);
    }

    @Data
    public static class Calibration {
        private int samples = 10;
        private Duration sampleSpacing = Duration.ofSeconds(1);
        /** A reference signal whose absolute mean is below this is treated as a disconnected sensor. */
        private double minSignal = 1e-3;
    }

    @Data
    public static class Tariff {
        private double ratePerKwh = 0.1168;
        private String currency = "$";
        private TimeOfUse timeOfUse = new TimeOfUse();
    }

    @Data
    public static class TimeOfUse {
        private boolean enabled = false;
        private double peakRate = 0.1568;
        private double midPeakRate = 0.1168;
        private double offPeakRate = 0.0968;
        private List<HourWindow> weekdayPeak = new ArrayList<>(List.of(new HourWindow(LocalTime.of(16, 0), LocalTime.of(21, 0))));
        private List<HourWindow> weekendPeak = new ArrayList<>(List.of(new HourWindow(LocalTime.of(18, 0), LocalTime.of(22, 0))));
        /** May wrap midnight. */
        private HourWindow offPeak = new HourWindow(LocalTime.of(22, 0), LocalTime.of(6, 0));
        private Map<Season, Double> seasonalMultipliers = defaultSeasonal();

        private static Map<Season, Double> defaultSeasonal() {
            Map<Season, Double> m = new EnumMap<>(Season.class);
            m.put(Season.WINTER, 1.15);
            m.put(Season.SPRING, 0.95);
            m.put(Season.SUMMER, 1.25);
            m.put(Season.FALL, 1.00);
            return m;
        }
    }

    @Data
    public static class HourWindow {
        private LocalTime start;
        private LocalTime end;

        public HourWindow() {}

        public HourWindow(LocalTime start, LocalTime end) {
            this.start = start;
            this.end = end;
        }

        /** [start, end); wraps midnight when end <= start. */
        public boolean contains(LocalTime t) {
            if (start == null || end == null) return false;
            if (end.isAfter(start)) return !t.isBefore(start) && t.isBefore(end);
            return !t.isBefore(start) || t.isBefore(end);
        }
    }

    public enum Season {
        WINTER, SPRING, SUMMER, FALL;

        public static Season of(Month m) {
            return switch (m) {
                case DECEMBER, JANUARY, FEBRUARY -> WINTER;
                case MARCH, APRIL, MAY -> SPRING;
                case JUNE, JULY, AUGUST -> SUMMER;
                default -> FALL;
            };
        }
    }

    @Data
    public static class Analysis {
        /** A sample counts as "on" above this fraction of the device's rated max. */
        private double onThresholdFraction = 0.05;
        private double alwaysOnDutyCycle = 0.8;
        private double intermittentDutyCycle = 0.15;
        /** Below the intermittent duty cycle, a peak at or above this fraction of rated max means peak-only. */
        private double peakOnlyPeakFraction = 0.5;
        /** Anomaly threshold is mean + k * stdev. */
        private double anomalyK = 3.0;
        private Duration cacheTtl = Duration.ofHours(6);
        private long cacheMaxEntries = 256;

        // score policy
        /** Points lost per unit of peak-to-average ratio above 1. */
        private double peakToAveragePenaltyPerUnit = 5.0;
        private double maxPeakToAveragePenalty = 50.0;
        /** Points lost per unit of hourly duty-cycle std-dev (0..0.5). */
        private double volatilityPenaltyPerUnit = 100.0;
        private double maxVolatilityPenalty = 50.0;

        /** Share of excess energy a recommendation is assumed to save, per category. */
        private double efficiencySavingsShare = 0.15;
        private double usagePatternSavingsShare = 0.10;
        private double costSavingsShare = 0.20;

        private double standbyAlertWatts = 5.0;
        private double co2KgPerKwh = 0.4;
        private double activeThresholdW = 50.0;
        private double standbyThresholdW = 1.0;
        /** Score below which an efficiency insight is emitted. */
        private double lowScore = 60.0;
    }

    @Data
    public static class Store {
        /** JSON-lines journal file. Empty = keep readings in memory only. */
        private String journalPath = "";
    }

    @Data
    public static class DeviceProperties {
        private String name;
        private String location;
        private DeviceType type = DeviceType.GENERIC;
        /** Null = use {@code monitor.sensor.mode}. */
        private SourceKind source;
        private int channel;
        private double voltage = 230.0;
        private double ctRatio = 1.0;
        /** Null until calibration runs; treated as 1.0. */
        private Double calibrationFactor;
        private double minWatts = 0.0;
        private double maxWatts = 1000.0;
        /** Optional per-device override of the poll interval. */
        private Duration pollingInterval;
    }
}
