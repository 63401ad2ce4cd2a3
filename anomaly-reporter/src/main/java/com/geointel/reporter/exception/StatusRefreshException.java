package com.geointel.reporter.exception;

import lombok.Getter;

@Getter
public class StatusRefreshException extends ReporterException {

    private final String issueKey;

    public StatusRefreshException(String issueKey, Throwable cause) {
        super("Status refresh failed on issue " + issueKey + ": " + cause.getMessage(), cause);
        this.issueKey = issueKey;
    }
}
