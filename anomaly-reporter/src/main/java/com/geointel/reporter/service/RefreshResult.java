package com.geointel.reporter.service;

/**
 * @param checked issues whose report status was queried
 * @param updated issues that received a status
 * @param missing issues for which the service returned no status
 */
public record RefreshResult(int checked, int updated, int missing) {
}
