package com.geointel.reporter.service;

import com.geointel.reporter.model.ReportRequest;

/**
 * Remote reporting service where reports are filed and tracked.
 */
public interface ReportingClient {

    /** Files a report and returns the id the service assigned to it. */
    long createReport(ReportRequest request);

    /** Current status of a report, null when the service does not return one. */
    String getStatus(long reportId);
}
