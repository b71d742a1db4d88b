package com.elssolution.energymonitor;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                // Keep the collector loop out of the way; ticks are not needed here
                "monitor.collector.auto-start=false",
                "monitor.calibration.samples=3",
                "monitor.calibration.sample-spacing=0s",
                "server.port=0"
        }
)
class SmokeTest {

    @LocalServerPort int port;

    @Autowired TestRestTemplate http;

    @MockitoBean ScheduledExecutorService scheduler;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void status_endpoint_returns_200() {
        var resp = http.getForEntity(url("/status"), String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("total_power_w").contains("\"state\":\"IDLE\"");
    }

    @Test
    void configured_devices_are_listed() {
        var resp = http.getForEntity(url("/devices"), String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("\"id\":\"fridge\"").contains("\"ct_ratio\"");
    }

    @Test
    void analysis_without_data_is_an_empty_report() {
        var resp = http.getForEntity(url("/analysis"), String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("\"scope\":\"system\"").contains("\"insights\":[]");
    }

    @Test
    void unknown_device_is_404() {
        var calibrate = http.postForEntity(url("/devices/ghost/calibrate?knownWatts=100"), null, String.class);
        var readings = http.getForEntity(url("/readings/ghost"), String.class);

        assertThat(calibrate.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(readings.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void bad_known_watts_is_400() {
        var resp = http.postForEntity(url("/devices/fridge/calibrate?knownWatts=-5"), null, String.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
