package com.geointel.reporter.model;

/**
 * Everything the reporting service needs to create one report.
 *
 * @param sketch JSON sketch annotation, null for standalone reports
 */
public record ReportRequest(double longitude,
                            double latitude,
                            String message,
                            String theme,
                            ReportMode mode,
                            String sketch) {
}
