package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.StatusRefreshException;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.store.IssueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls the reporting service for the status of every report not yet closed.
 * Only cluster owners carry a status, linked members are never polled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatusRefreshService {

    private final IssueStore store;
    private final ReportingClient reportingClient;
    private final ReporterProperties properties;
    private final CallPacer pacer;

    public RefreshResult refresh() {
        List<Issue> unclosed = store.selectUnclosed(properties.getReporting().getUnclosedStatuses());
        log.info("{} report status(es) to refresh", unclosed.size());

        LocalDateTime refreshedAt = LocalDateTime.now();
        int updated = 0;
        int missing = 0;

        for (Issue issue : unclosed) {
            try {
                pacer.checkNotInterrupted();
                String status = reportingClient.getStatus(issue.getReportLink().reportId());
                pacer.pause();
                if (status == null) {
                    missing++;
                    log.debug("No status returned for issue {}, left untouched", issue.getExternalKey());
                    continue;
                }
                issue.setReportStatus(status);
                issue.setStatusRefreshedAt(refreshedAt);
                store.persist(issue);
                updated++;
            } catch (RuntimeException e) {
                log.error("Status refresh failed on issue {}: {}", issue.getExternalKey(), e.getMessage(), e);
                throw new StatusRefreshException(issue.getExternalKey(), e);
            }
        }

        log.info("Status refresh complete: {} checked, {} updated, {} without status",
                unclosed.size(), updated, missing);
        return new RefreshResult(unclosed.size(), updated, missing);
    }
}
