package com.geointel.reporter.exception;

/**
 * Root of the errors raised by the reconciliation engine and its adapters.
 */
public class ReporterException extends RuntimeException {

    public ReporterException(String message) {
        super(message);
    }

    public ReporterException(String message, Throwable cause) {
        super(message, cause);
    }
}
