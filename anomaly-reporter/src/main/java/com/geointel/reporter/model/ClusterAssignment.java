package com.geointel.reporter.model;

/**
 * One row returned by the spatial service's clustering call.
 * Geometry and centroid are null exactly when clusterKey is null.
 */
public record ClusterAssignment(String key,
                                String clusterKey,
                                String boundingGeometry,
                                Double centroidLon,
                                Double centroidLat) {

    public static ClusterAssignment standalone(String key) {
        return new ClusterAssignment(key, null, null, null, null);
    }

    public boolean isClustered() {
        return clusterKey != null;
    }
}
