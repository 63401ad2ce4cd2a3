package com.geointel.reporter.exception;

import lombok.Getter;

/**
 * Emission aborted on an issue. Issues persisted before it in the same run stay reported.
 */
@Getter
public class ReportEmissionException extends ReporterException {

    private final String issueKey;
    private final int reportsCreatedBeforeFailure;

    public ReportEmissionException(String issueKey, int reportsCreatedBeforeFailure, Throwable cause) {
        super("Report emission failed on issue " + issueKey
                + " after " + reportsCreatedBeforeFailure + " report(s) created: " + cause.getMessage(), cause);
        this.issueKey = issueKey;
        this.reportsCreatedBeforeFailure = reportsCreatedBeforeFailure;
    }
}
