package com.geointel.reporter.service;

import com.geointel.reporter.model.Issue;
import com.geointel.reporter.store.IssueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Selects the stored issues still waiting for a report: no report reference yet,
 * and resolved as lying outside every policy zone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EligibilityFilter {

    private final IssueStore store;

    public List<Issue> selectEligible() {
        List<Issue> eligible = store.selectEligible();
        log.info("{} issue(s) eligible for a report", eligible.size());
        return eligible;
    }
}
