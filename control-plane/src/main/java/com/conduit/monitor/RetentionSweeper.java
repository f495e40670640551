package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.control.TickGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Component
public class RetentionSweeper {

    private final MetricsHistory history;
    private final AlertManager alertManager;
    private final Duration metricsRetention;
    private final Duration alertRetention;
    private final Clock clock;
    private final TickGuard guard = new TickGuard();

    public RetentionSweeper(MetricsHistory history, AlertManager alertManager,
                            MonitorProperties properties, Clock clock) {
        this.history = history;
        this.alertManager = alertManager;
        this.metricsRetention = Duration.ofMillis(properties.getMetricsRetentionMs());
        this.alertRetention = Duration.ofMillis(properties.getAlertRetentionMs());
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${conduit.monitor.sweep-interval-ms:300000}",
            initialDelayString = "${conduit.monitor.sweep-interval-ms:300000}")
    public void execute() {
        if (guard.begin() < 0) {
            return;
        }
        try {
            Instant now = clock.instant();
            int samples = history.sweep(now.minus(metricsRetention));
            int alerts = alertManager.sweep(now.minus(alertRetention));

            if (samples > 0 || alerts > 0) {
                log.info("Retention sweep removed {} samples and {} alerts", samples, alerts);
            }
        } catch (Exception e) {
            log.error("Retention sweep failed", e);
        }
    }

    public void close() {
        guard.close();
    }
}
