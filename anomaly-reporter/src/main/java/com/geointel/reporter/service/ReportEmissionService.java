package com.geointel.reporter.service;

import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.exception.ReportEmissionException;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.ReportLink;
import com.geointel.reporter.model.ReportMode;
import com.geointel.reporter.model.ReportRequest;
import com.geointel.reporter.store.IssueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Files reports for correlated issues, one report per standalone issue and one per cluster.
 *
 * The first member of a cluster owns the report and stores its positive id; the following
 * members store the negated id and trigger no remote call. Each issue is persisted as soon
 * as it is handled, so a failure leaves every earlier issue reported.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportEmissionService {

    private final ReportingClient reportingClient;
    private final IssueStore store;
    private final ReportMessageComposer composer;
    private final CallPacer pacer;

    /**
     * @param issues issues in clustering order, as returned by {@link ClusterCorrelationService}
     * @throws ReportEmissionException on the first issue that cannot be reported
     */
    public EmissionResult emit(List<Issue> issues, ReportMode mode) {
        if (!mode.emitsReports()) {
            throw new IllegalArgumentException("Report mode " + mode + " does not emit reports");
        }
        if (issues.isEmpty()) return EmissionResult.empty();

        LocalDateTime refreshedAt = LocalDateTime.now();
        EmissionState state = EmissionState.initial();

        for (Issue issue : issues) {
            EmissionState next;
            try {
                pacer.checkNotInterrupted();
                next = emitOne(issue, mode, state, refreshedAt);
            } catch (RuntimeException e) {
                throw failure(issue, state, e);
            }

            boolean reportCreated = next.reportsCreated() > state.reportsCreated();
            state = next;
            if (reportCreated) {
                // issue already persisted, pacing follows the remote call
                try {
                    pacer.pause();
                } catch (RuntimeException e) {
                    throw failure(issue, state, e);
                }
            }
        }

        log.info("Emission complete: {} report(s) created, {} issue(s) linked to a cluster report",
                state.reportsCreated(), state.issuesLinked());
        return new EmissionResult(state.reportsCreated(), state.issuesLinked(), issues.size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private EmissionState emitOne(Issue issue, ReportMode mode, EmissionState state, LocalDateTime refreshedAt) {
        String description = composer.compose(issue);
        issue.setDescription(description);

        String clusterKey = issue.getClusterKey();
        ReportLink link;
        EmissionState next;

        if (clusterKey == null) {
            long id = createReport(issue, description, null, mode);
            link = ReportLink.owner(id);
            next = state.afterStandalone();
        } else if (state.continuesCluster(clusterKey)) {
            link = ReportLink.linkedTo(state.ownerReportId());
            next = state.afterLinked();
        } else {
            long id = createReport(issue, composer.withClusterNotice(description), issue.getSketch(), mode);
            link = ReportLink.owner(id);
            next = state.afterClusterOwner(clusterKey, id);
        }

        issue.setReportLink(link);
        issue.setReportStatus(link instanceof ReportLink.Owner ? mode.getCode() : null);
        issue.setStatusRefreshedAt(refreshedAt);
        store.persist(issue);

        if (link instanceof ReportLink.Owner) {
            log.info("Report {} created for issue {} ({} so far)", link.reportId(), issue.getExternalKey(),
                    next.reportsCreated());
        } else {
            log.debug("Issue {} linked to cluster report {}", issue.getExternalKey(), link.reportId());
        }
        return next;
    }

    private long createReport(Issue issue, String message, String sketch, ReportMode mode) {
        long id = reportingClient.createReport(new ReportRequest(
                issue.getLongitude(), issue.getLatitude(), message, issue.getTheme(), mode, sketch));
        if (id <= 0) {
            throw new DataContractViolationException("Reporting service returned non-positive report id " + id);
        }
        return id;
    }

    private ReportEmissionException failure(Issue issue, EmissionState state, RuntimeException e) {
        log.error("Report emission failed on issue {}: {}", issue.getExternalKey(), e.getMessage(), e);
        return new ReportEmissionException(issue.getExternalKey(), state.reportsCreated(), e);
    }
}
