package com.geointel.reporter.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filters of one issues.json call. One call per (country, source, item, class).
 */
@Value
@Builder
public class FeedQuery {

    String country;
    String source;
    int itemId;
    int classId;
    FeedStatus status;
    LocalDate startDate;
    LocalDate endDate;
    String useDevItem;
}
