package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.ReportEmissionException;
import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.ReconciliationRun;
import com.geointel.reporter.model.ReportMode;
import com.geointel.reporter.model.RunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Orchestrates a reconciliation run: feed ingestion, policy-zone resolution,
 * correlation and emission of reports, then status refresh.
 *
 * One run at a time. A failing run is summarised in the log and rethrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationService {

    /** The feed holds no usable history before that date. */
    static final LocalDate EARLIEST_START = LocalDate.of(2020, 1, 1);

    private final IssueIngestionService ingestionService;
    private final PolicyZoneResolver policyZoneResolver;
    private final EligibilityFilter eligibilityFilter;
    private final ClusterCorrelationService correlationService;
    private final ReportEmissionService emissionService;
    private final StatusRefreshService statusRefreshService;
    private final IssueFeedClient feedClient;
    private final SpatialReferenceService spatialService;
    private final ReporterProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ReconciliationRun> lastRun = new AtomicReference<>();

    /**
     * Run request built from the reporter.run defaults, covering the last lookback-days days.
     */
    public RunRequest defaultRequest() {
        ReporterProperties.Run defaults = properties.getRun();
        LocalDate today = LocalDate.now();
        return RunRequest.builder()
                .mode(ReportMode.fromCode(defaults.getMode()))
                .countries(defaults.getCountries())
                .sources(defaults.getSources())
                .items(defaults.getItems())
                .startDate(today.minusDays(defaults.getLookbackDays()))
                .endDate(today)
                .build();
    }

    public ReconciliationRun run(RunRequest request) {
        return execute(request.getMode(), run -> {
            validate(request);

            if (request.collectsFeed()) {
                IngestionResult ingestion = ingestionService.ingest(request);
                run.setIssuesCollected(ingestion.collected());
                run.setIssuesNew(ingestion.newIssues());
                run.setIssuesPersisted(ingestion.persisted());
            } else {
                log.info("Feed collection skipped (mode {}, statuses only: {})",
                        request.getMode().getCode(), request.isStatusesOnly());
            }

            run.setPolicyZonesResolved(policyZoneResolver.resolve());

            if (request.getMode().emitsReports() && request.getFeedStatus() == FeedStatus.FALSE_POSITIVE) {
                List<Issue> eligible = eligibilityFilter.selectEligible();
                run.setIssuesEligible(eligible.size());
                List<Issue> correlated = correlationService.correlate(eligible);
                EmissionResult emission = emissionService.emit(correlated, request.getMode());
                run.setReportsCreated(emission.reportsCreated());
                run.setIssuesLinked(emission.issuesLinked());
            } else {
                log.info("No report emitted (mode {}, feed status {})",
                        request.getMode().getCode(), request.getFeedStatus().getCode());
            }

            run.setStatusesUpdated(statusRefreshService.refresh().updated());
        });
    }

    /** Refreshes report statuses alone. */
    public ReconciliationRun refreshStatuses() {
        return execute(ReportMode.SKIP, run -> run.setStatusesUpdated(statusRefreshService.refresh().updated()));
    }

    public Optional<ReconciliationRun> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @throws IllegalArgumentException describing the first implausible parameter
     */
    public void validate(RunRequest request) {
        if (request.getItems().isEmpty()) {
            throw new IllegalArgumentException("At least one item is required");
        }
        for (Integer item : request.getItems()) {
            if (!properties.getItems().containsKey(item)) {
                throw new IllegalArgumentException("Item " + item + " is not in the catalog");
            }
        }

        if (request.getStartDate() != null && !request.getStartDate().isAfter(EARLIEST_START)) {
            throw new IllegalArgumentException("Start date must be after " + EARLIEST_START);
        }
        if (request.getStartDate() != null && request.getEndDate() != null
                && !request.getStartDate().isBefore(request.getEndDate())) {
            throw new IllegalArgumentException("Start date must be before end date");
        }

        if (request.hasDepartmentFilter() && request.hasRegionFilter()) {
            throw new IllegalArgumentException("Department and region filters are mutually exclusive");
        }
        if (request.hasDepartmentFilter()) {
            requireKnown("department", request.getDepartments(), spatialService.listDepartmentCodes());
        }
        if (request.hasRegionFilter()) {
            requireKnown("region", request.getRegions(), spatialService.listRegionCodes());
        }

        if (request.collectsFeed()) {
            if (request.getCountries().isEmpty()) {
                throw new IllegalArgumentException("At least one country is required to collect the feed");
            }
            requireKnown("country", request.getCountries(), feedClient.fetchCountries());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ReconciliationRun execute(ReportMode mode, Consumer<ReconciliationRun> steps) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A reconciliation run is already in progress");
        }

        ReconciliationRun run = ReconciliationRun.builder()
                .runId(UUID.randomUUID().toString())
                .mode(mode)
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        lastRun.set(run);
        log.info("Reconciliation run {} started (mode {})", run.getRunId(), mode.getCode());

        try {
            steps.accept(run);
            run.setStatus("SUCCESS");
            return run;

        } catch (RuntimeException e) {
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            if (e instanceof ReportEmissionException emission) {
                run.setReportsCreated(emission.getReportsCreatedBeforeFailure());
            }
            log.error("Reconciliation run {} failed: {}", run.getRunId(), e.getMessage(), e);
            throw e;

        } finally {
            run.setCompletedAt(LocalDateTime.now());
            log.info("Reconciliation run {} {}: collected={} new={} persisted={} policyResolved={} eligible={}"
                            + " reportsCreated={} linked={} statusesUpdated={}",
                    run.getRunId(), run.getStatus(), run.getIssuesCollected(), run.getIssuesNew(),
                    run.getIssuesPersisted(), run.getPolicyZonesResolved(), run.getIssuesEligible(),
                    run.getReportsCreated(), run.getIssuesLinked(), run.getStatusesUpdated());
            running.set(false);
        }
    }

    private static void requireKnown(String label, List<String> requested, List<String> known) {
        Set<String> unknown = new HashSet<>(requested);
        known.forEach(unknown::remove);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown " + label + "(s): " + unknown);
        }
    }
}
