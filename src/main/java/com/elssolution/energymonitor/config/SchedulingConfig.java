package com.elssolution.energymonitor.config;

import com.elssolution.energymonitor.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class SchedulingConfig {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /** Collector timer and the periodic summary logger. */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(2, namedDaemon("em-sched-"));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /**
     * Per-tick device reads. Sized to the device count, capped by {@code monitor.collector.max-workers},
     * so one slow device holds one thread and nothing else.
     */
    @Bean(name = "collectorWorkers", destroyMethod = "shutdownNow")
    public ExecutorService collectorWorkers(DeviceRegistry registry, MonitorProperties props) {
        int size = Math.max(1, Math.min(registry.size(), props.getCollector().getMaxWorkers()));
        ThreadPoolExecutor ex = new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemon("em-poll-"));
        ex.allowCoreThreadTimeOut(true);
        log.info("collector_workers_ready size={}", size);
        return ex;
    }

    private ThreadFactory namedDaemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet());
            t.setDaemon(true); // Spring shuts the pools down; never block JVM exit
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
