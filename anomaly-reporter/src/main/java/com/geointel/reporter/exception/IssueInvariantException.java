package com.geointel.reporter.exception;

import lombok.Getter;

/**
 * A local issue record lacks data required to process it.
 */
@Getter
public class IssueInvariantException extends ReporterException {

    private final String issueKey;

    public IssueInvariantException(String issueKey, String message) {
        super("Issue " + issueKey + ": " + message);
        this.issueKey = issueKey;
    }
}
