package com.geointel.reporter.model;

import java.time.LocalDateTime;

/**
 * Per-issue detail fields fetched separately from the feed.
 */
public record IssueDetail(Double minLat,
                          Double maxLat,
                          Double minLon,
                          Double maxLon,
                          LocalDateTime detectedAt) {
}
