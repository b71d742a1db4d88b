package com.elssolution.energymonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Last line of defence for collector and worker threads: logs and raises {@code UNCAUGHT}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    public static final String ALERT_KEY = "UNCAUGHT";

    private final AlertService alerts;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("uncaught_handler_installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;
        log.error("uncaught thread={} err={}", t.getName(), e.toString(), e);
        alerts.raise(ALERT_KEY, t.getName() + ": " + e, AlertService.Severity.CRITICAL);
    }
}
