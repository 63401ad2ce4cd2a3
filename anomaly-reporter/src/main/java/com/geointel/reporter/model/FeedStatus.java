package com.geointel.reporter.model;

import java.util.Arrays;

/**
 * Status category of an anomaly as published by the QA feed.
 * Only false positives are ever turned into reports.
 */
public enum FeedStatus {

    OPEN("open"),
    DONE("done"),
    FALSE_POSITIVE("false");

    private final String code;

    FeedStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static FeedStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown feed status: " + code));
    }
}
