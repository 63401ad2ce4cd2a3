package com.geointel.reporter.exception;

/**
 * An external service answered with data that breaks its documented contract
 * (unknown keys, non-adjacent cluster rows, non-positive report ids...). Always fatal for the run.
 */
public class DataContractViolationException extends ReporterException {

    public DataContractViolationException(String message) {
        super(message);
    }

    public DataContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
