package com.geointel.reporter.service;

/**
 * @param collected distinct issues returned by the feed
 * @param newIssues of those, issues unknown to the store
 * @param persisted of those, issues inside the spatial filter and stored
 */
public record IngestionResult(int collected, int newIssues, int persisted) {

    public static IngestionResult empty() {
        return new IngestionResult(0, 0, 0);
    }
}
