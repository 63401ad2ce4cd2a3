package com.geointel.reporter.model;

import java.util.Arrays;

/**
 * Run-scoped reporting mode.
 *
 *  - SKIP: no report is emitted
 *  - DRY_RUN: reports are posted with status "test" (received but not forwarded to collectors)
 *  - SUBMIT: reports are posted with status "submit"
 *  - RESUBMIT_UNREPORTED: incident recovery, feed collection is skipped and
 *    every stored issue without a report is posted with status "submit"
 *
 * The code is what gets persisted as the owning issue's report status.
 */
public enum ReportMode {

    SKIP("skip", null),
    DRY_RUN("test", "test"),
    SUBMIT("submit", "submit"),
    RESUBMIT_UNREPORTED("repost", "submit");

    private final String code;
    private final String wireStatus;

    ReportMode(String code, String wireStatus) {
        this.code = code;
        this.wireStatus = wireStatus;
    }

    public String getCode() {
        return code;
    }

    /** Status value sent to the reporting service when a report is created. */
    public String getWireStatus() {
        return wireStatus;
    }

    public boolean emitsReports() {
        return this != SKIP;
    }

    public static ReportMode fromCode(String code) {
        return Arrays.stream(values())
                .filter(m -> m.code.equalsIgnoreCase(code) || m.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown report mode: " + code));
    }
}
