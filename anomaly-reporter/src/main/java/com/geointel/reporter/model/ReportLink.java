package com.geointel.reporter.model;

/**
 * Link between an issue and a remote report.
 *
 * The durable form is a single signed integer: the issue that triggered the report
 * stores the positive id ({@link Owner}), every other member of the same cluster stores
 * its negation ({@link LinkedTo}). Only the owner's report status is authoritative.
 */
public sealed interface ReportLink permits ReportLink.Owner, ReportLink.LinkedTo {

    /** Id of the remote report, always positive. */
    long reportId();

    /** Signed value as persisted in the store. */
    long storedValue();

    static ReportLink fromStoredValue(long value) {
        if (value > 0) return new Owner(value);
        if (value < 0) return new LinkedTo(-value);
        throw new IllegalArgumentException("Report reference 0 is not a valid link");
    }

    static Owner owner(long reportId) {
        return new Owner(reportId);
    }

    /** Link to the owner's report; the sign is applied fresh whatever the sign of the input. */
    static LinkedTo linkedTo(long reportId) {
        return new LinkedTo(Math.abs(reportId));
    }

    record Owner(long reportId) implements ReportLink {
        public Owner {
            if (reportId <= 0) {
                throw new IllegalArgumentException("Owner report id must be positive: " + reportId);
            }
        }

        @Override
        public long storedValue() {
            return reportId;
        }
    }

    record LinkedTo(long reportId) implements ReportLink {
        public LinkedTo {
            if (reportId <= 0) {
                throw new IllegalArgumentException("Linked report id must be positive: " + reportId);
            }
        }

        @Override
        public long storedValue() {
            return -reportId;
        }
    }
}
