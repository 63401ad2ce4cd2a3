package com.geointel.reporter.scheduler;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.service.ReconciliationService;
import com.geointel.reporter.store.IssueStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup reconciliation.
 *
 * Default schedule: full run every Monday at 03:00 UTC, status refresh every day at 06:00 UTC.
 * Override with RECONCILE_CRON / STATUS_REFRESH_CRON or the reporter.scheduling properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;
    private final IssueStore issueStore;
    private final ReporterProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the store schema exists
     *  2. Optionally run once if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        issueStore.ensureSchema();

        ReporterProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup() && !scheduling.isOneShot()) {
            log.info("RUN_ON_STARTUP=true, running reconciliation with default parameters");
            try {
                reconciliationService.run(reconciliationService.defaultRequest());
            } catch (Exception e) {
                log.error("Startup reconciliation failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Reporter ready. Next scheduled run: {}, status refresh: {}",
                    scheduling.getCron(), scheduling.getStatusRefreshCron());
        }
    }

    @Scheduled(cron = "${reporter.scheduling.cron:0 0 3 * * MON}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled reconciliation triggered");
        try {
            reconciliationService.run(reconciliationService.defaultRequest());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${reporter.scheduling.status-refresh-cron:0 0 6 * * *}", zone = "UTC")
    public void scheduledStatusRefresh() {
        log.info("Scheduled status refresh triggered");
        try {
            reconciliationService.refreshStatuses();
        } catch (Exception e) {
            log.error("Scheduled status refresh failed: {}", e.getMessage(), e);
        }
    }
}
