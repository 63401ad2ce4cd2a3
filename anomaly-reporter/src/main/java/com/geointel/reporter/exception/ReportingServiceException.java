package com.geointel.reporter.exception;

import lombok.Getter;

/**
 * The reporting service refused to create a report.
 */
@Getter
public class ReportingServiceException extends ReporterException {

    private final int httpStatus;
    private final String responseBody;

    public ReportingServiceException(int httpStatus, String responseBody) {
        super("Report creation refused, HTTP " + httpStatus + ": " + responseBody);
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }
}
