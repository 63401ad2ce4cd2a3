package com.geointel.reporter.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Summary of one reconciliation run, for logs and the trigger API.
 */
@Data
@Builder
public class ReconciliationRun {

    private String runId;           // UUID
    private ReportMode mode;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int issuesCollected;
    private int issuesNew;
    private int issuesPersisted;
    private int policyZonesResolved;
    private int issuesEligible;
    private int reportsCreated;
    private int issuesLinked;
    private int statusesUpdated;
    private String errorMessage;    // null on success
}
