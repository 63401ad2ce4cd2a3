package com.geointel.reporter.service;

/**
 * Accumulator of the report emission fold.
 *
 * @param clusterKey    cluster whose report was opened last, null after a standalone report
 * @param ownerReportId report id of that cluster's owner, null when clusterKey is null
 */
record EmissionState(String clusterKey, Long ownerReportId, int reportsCreated, int issuesLinked) {

    static EmissionState initial() {
        return new EmissionState(null, null, 0, 0);
    }

    boolean continuesCluster(String key) {
        return key != null && key.equals(clusterKey);
    }

    EmissionState afterStandalone() {
        return new EmissionState(null, null, reportsCreated + 1, issuesLinked);
    }

    EmissionState afterClusterOwner(String key, long reportId) {
        return new EmissionState(key, reportId, reportsCreated + 1, issuesLinked);
    }

    EmissionState afterLinked() {
        return new EmissionState(clusterKey, ownerReportId, reportsCreated, issuesLinked + 1);
    }
}
