package com.geointel.reporter.model;

/**
 * Minimal projection of an issue sent to the spatial service for clustering.
 */
public record ClusterCandidate(String key,
                               double latitude,
                               double longitude,
                               Integer itemId,
                               Integer classId,
                               String attribute1) {

    public static ClusterCandidate of(Issue issue) {
        return new ClusterCandidate(
                issue.getExternalKey(),
                issue.getLatitude(),
                issue.getLongitude(),
                issue.getItemId(),
                issue.getClassId(),
                issue.getAttribute1());
    }
}
