package com.elssolution.energymonitor.store;

import com.elssolution.energymonitor.domain.AggregateFn;
import com.elssolution.energymonitor.domain.Maths;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.ReadingField;
import com.elssolution.energymonitor.domain.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.elssolution.energymonitor.support.Fixtures.reading;
import static com.elssolution.energymonitor.support.Fixtures.count;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryReadingStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryReadingStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore();
        store.append(reading("tv", T0, 100, 0.0, 0.0));
        store.append(reading("tv", T0.plusSeconds(60), 200, 2.5, 0.0003));
        store.append(reading("tv", T0.plusSeconds(120), 300, 4.1667, 0.0005));
        store.append(reading("fridge", T0, 40, 0.0, 0.0));
    }

    private static List<Double> powers(Iterable<Reading> it) {
        List<Double> out = new ArrayList<>();
        it.forEach(r -> out.add(r.getPowerW()));
        return out;
    }

    @Test
    void query_is_ascending_and_half_open() {
        assertThat(powers(store.query("tv", new TimeRange(T0, T0.plusSeconds(120))))).containsExactly(100.0, 200.0);
        assertThat(powers(store.query("tv", new TimeRange(T0.plusSeconds(1), T0.plusSeconds(121))))).containsExactly(200.0, 300.0);
    }

    @Test
    void query_is_lazy_and_restartable() {
        Iterable<Reading> it = store.query("tv", new TimeRange(T0, T0.plusSeconds(3600)));
        assertThat(powers(it)).hasSize(3);

        store.append(reading("tv", T0.plusSeconds(180), 50, 1.0, 0.0));

        assertThat(powers(it)).containsExactly(100.0, 200.0, 300.0, 50.0);
        assertThat(powers(it)).containsExactly(100.0, 200.0, 300.0, 50.0);
    }

    @Test
    void out_of_order_append_is_refused() {
        assertThatThrownBy(() -> store.append(reading("tv", T0.plusSeconds(30), 1, 0, 0)))
                .isInstanceOf(StoreWriteException.class)
                .hasMessageContaining("out-of-order");
        assertThat(count(store, "tv")).isEqualTo(3);
    }

    @Test
    void equal_timestamps_keep_arrival_order() {
        store.append(reading("tv", T0.plusSeconds(120), 301, 0, 0));

        assertThat(powers(store.query("tv", new TimeRange(T0.plusSeconds(120), T0.plusSeconds(121)))))
                .containsExactly(300.0, 301.0);
    }

    @Test
    void aggregates_over_power_and_energy() {
        TimeRange all = new TimeRange(T0, T0.plusSeconds(3600));

        assertThat(store.aggregate("tv", all, AggregateFn.MEAN)).isCloseTo(200.0, within(1e-9));
        assertThat(store.aggregate("tv", all, AggregateFn.MAX)).isEqualTo(300.0);
        assertThat(store.aggregate("tv", all, AggregateFn.SUM)).isEqualTo(600.0);
        assertThat(store.aggregate("tv", all, AggregateFn.STDEV)).isCloseTo(Math.sqrt(20000.0 / 3), within(1e-9));
        // energy increments were integrated at write time; summing them is the window total
        assertThat(store.aggregate("tv", all, AggregateFn.SUM, ReadingField.ENERGY_WH)).isCloseTo(6.6667, within(1e-9));
    }

    @Test
    void stdev_keeps_precision_on_a_large_nearly_constant_load() {
        double[] values = new double[1440];
        for (int i = 0; i < values.length; i++) {
            values[i] = 2345.67 + (i % 2 == 0 ? 1e-4 : 0.0);
            store.append(reading("heater", T0.plusSeconds(60L * i), values[i], 0, 0));
        }
        TimeRange day = new TimeRange(T0, T0.plusSeconds(86_400));

        double stdev = store.aggregate("heater", day, AggregateFn.STDEV);

        assertThat(stdev).isCloseTo(5e-5, within(1e-9));
        assertThat(stdev).isCloseTo(Maths.stdev(values), within(1e-12));
    }

    @Test
    void empty_range_and_unknown_device_aggregate_to_zero() {
        TimeRange nothing = new TimeRange(T0.minusSeconds(100), T0.minusSeconds(50));

        assertThat(store.aggregate("tv", nothing, AggregateFn.MEAN)).isZero();
        assertThat(store.aggregate("nope", nothing, AggregateFn.MAX)).isZero();
        assertThat(store.query("nope", nothing)).isEmpty();
    }

    @Test
    void latest_and_device_ids() {
        assertThat(store.latest("tv")).map(Reading::getPowerW).contains(300.0);
        assertThat(store.latest("nope")).isEmpty();
        assertThat(store.deviceIds()).containsExactlyInAnyOrder("tv", "fridge");
    }

    @Test
    void readers_see_whole_readings_while_a_writer_appends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch go = new CountDownLatch(1);
        TimeRange all = new TimeRange(T0, T0.plusSeconds(1_000_000));
        try {
            Future<?> writer = pool.submit(() -> {
                go.await();
                for (int i = 1; i <= 5000; i++) {
                    store.append(reading("w", T0.plusSeconds(i), i, i, i));
                }
                return null;
            });
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readers.add(pool.submit(() -> {
                    go.await();
                    int seen = 0;
                    for (int pass = 0; pass < 50; pass++) {
                        double last = 0;
                        for (Reading x : store.query("w", all)) {
                            assertThat(x.getPowerW()).isEqualTo(x.getEnergyWh()).isGreaterThan(last);
                            last = x.getPowerW();
                            seen++;
                        }
                    }
                    return seen;
                }));
            }
            go.countDown();
            writer.get(10, TimeUnit.SECONDS);
            for (Future<Integer> f : readers) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(count(store, "w")).isEqualTo(5000);
    }
}
