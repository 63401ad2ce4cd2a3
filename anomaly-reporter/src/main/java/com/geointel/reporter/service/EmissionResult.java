package com.geointel.reporter.service;

public record EmissionResult(int reportsCreated, int issuesLinked, int issuesProcessed) {

    public static EmissionResult empty() {
        return new EmissionResult(0, 0, 0);
    }
}
