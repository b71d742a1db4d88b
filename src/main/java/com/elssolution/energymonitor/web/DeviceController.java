package com.elssolution.energymonitor.web;

import com.elssolution.energymonitor.analysis.InsightProducer;
import com.elssolution.energymonitor.config.DeviceRegistry;
import com.elssolution.energymonitor.domain.*;
import com.elssolution.energymonitor.service.CalibrationException;
import com.elssolution.energymonitor.service.Calibrator;
import com.elssolution.energymonitor.store.ReadingStore;
import lombok.Builder;
import lombok.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Devices, their readings, analysis and calibration. Periods default to the last 24 hours,
 * aligned to the minute so repeated calls hit the analysis cache.
 */
@RestController
public class DeviceController {

    private static final long DEFAULT_HOURS = 24;

    @Value @Builder
    public static class DeviceView {
        String id;
        String name;
        String location;
        DeviceType type;
        SourceKind source;
        int channel;
        double voltage;
        double ctRatio;
        double calibrationFactor;
        double minWatts;
        double maxWatts;
        Long pollingIntervalMs;
    }

    @Value @Builder
    public static class AggregateView {
        String deviceId;
        AggregateFn fn;
        ReadingField field;
        Instant from;
        Instant to;
        double value;
    }

    @Value @Builder
    public static class CalibrationView {
        String deviceId;
        double knownWatts;
        double meanRaw;
        /** Watts per raw unit measured under the reference load. */
        double scale;
        double calibrationFactor;
        double previousFactor;
    }

    private final DeviceRegistry registry;
    private final ReadingStore store;
    private final InsightProducer analyzer;
    private final Calibrator calibrator;
    private final Clock clock;

    public DeviceController(DeviceRegistry registry, ReadingStore store, InsightProducer analyzer,
                            Calibrator calibrator, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.analyzer = analyzer;
        this.calibrator = calibrator;
        this.clock = clock;
    }

    @GetMapping("/devices")
    public List<DeviceView> devices() {
        return registry.all().stream().map(DeviceController::view).toList();
    }

    @GetMapping("/readings/{id}")
    public List<Reading> readings(@PathVariable("id") String id,
                                  @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                  @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        registry.require(id);
        List<Reading> out = new ArrayList<>();
        store.query(id, period(from, to)).forEach(out::add);
        return out;
    }

    @GetMapping("/readings/{id}/aggregate")
    public AggregateView aggregate(@PathVariable("id") String id,
                                   @RequestParam(name = "fn", defaultValue = "MEAN") AggregateFn fn,
                                   @RequestParam(name = "field", defaultValue = "POWER_W") ReadingField field,
                                   @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                   @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        registry.require(id);
        TimeRange range = period(from, to);
        return AggregateView.builder()
                .deviceId(id).fn(fn).field(field)
                .from(range.from()).to(range.to())
                .value(store.aggregate(id, range, fn, field))
                .build();
    }

    /** Whole system when {@code device} is absent. */
    @GetMapping("/analysis")
    public AnalysisReport analysis(@RequestParam(name = "device", required = false) String device,
                                   @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                   @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        AnalysisScope scope = device == null || device.isBlank() ? AnalysisScope.system() : AnalysisScope.device(device);
        return analyzer.analyze(scope, period(from, to));
    }

    @PostMapping("/devices/{id}/calibrate")
    public CalibrationView calibrate(@PathVariable("id") String id,
                                     @RequestParam("knownWatts") double knownWatts) throws CalibrationException {
        Calibrator.Result r = calibrator.calibrate(id, knownWatts);
        return CalibrationView.builder()
                .deviceId(id)
                .knownWatts(r.getKnownWatts())
                .meanRaw(r.getMeanRaw())
                .scale(r.getScale())
                .calibrationFactor(r.getFactor())
                .previousFactor(r.getPreviousFactor())
                .build();
    }

    private TimeRange period(Instant from, Instant to) {
        Instant end = to != null ? to : clock.instant().truncatedTo(ChronoUnit.MINUTES);
        Instant start = from != null ? from : end.minus(DEFAULT_HOURS, ChronoUnit.HOURS);
        return new TimeRange(start, end);
    }

    private static DeviceView view(Device d) {
        return DeviceView.builder()
                .id(d.getId())
                .name(d.getName())
                .location(d.getLocation())
                .type(d.getType())
                .source(d.getSource())
                .channel(d.getChannel())
                .voltage(d.getVoltage())
                .ctRatio(d.getCtRatio())
                .calibrationFactor(d.getCalibrationFactor())
                .minWatts(d.getMinWatts())
                .maxWatts(d.getMaxWatts())
                .pollingIntervalMs(d.getPollingInterval() == null ? null : d.getPollingInterval().toMillis())
                .build();
    }
}
