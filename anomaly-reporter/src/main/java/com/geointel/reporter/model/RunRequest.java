package com.geointel.reporter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Parameters of one reconciliation run.
 */
@Value
@Builder(toBuilder = true)
public class RunRequest {

    @Builder.Default
    ReportMode mode = ReportMode.SKIP;

    @Builder.Default
    FeedStatus feedStatus = FeedStatus.FALSE_POSITIVE;

    /** Only refresh report statuses, skip feed collection */
    boolean statusesOnly;

    @Singular
    List<String> countries;

    @Singular
    List<String> sources;

    @Singular
    List<Integer> items;

    /** Department codes to keep, mutually exclusive with regions */
    List<String> departments;

    /** Region codes to keep, mutually exclusive with departments */
    List<String> regions;

    LocalDate startDate;

    LocalDate endDate;

    @Builder.Default
    String useDevItem = "false";

    public boolean collectsFeed() {
        return !statusesOnly && mode != ReportMode.RESUBMIT_UNREPORTED;
    }

    public boolean hasDepartmentFilter() {
        return departments != null && !departments.isEmpty();
    }

    public boolean hasRegionFilter() {
        return regions != null && !regions.isEmpty();
    }

    /** True when no spatial filter is requested or the issue falls inside it. */
    public boolean acceptsLocation(Issue issue) {
        if (!hasDepartmentFilter() && !hasRegionFilter()) return true;
        if (hasDepartmentFilter() && departments.contains(issue.getDepartmentCode())) return true;
        return hasRegionFilter() && regions.contains(issue.getRegionCode());
    }
}
