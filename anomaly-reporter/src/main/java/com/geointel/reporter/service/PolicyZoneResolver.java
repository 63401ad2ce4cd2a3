package com.geointel.reporter.service;

import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.store.IssueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides for each stored issue whether it lies in a policy-restricted zone.
 * Issues the reference geography cannot decide stay unknown and are retried next run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PolicyZoneResolver {

    private final IssueStore store;
    private final SpatialReferenceService spatialService;

    /** @return number of issues whose flag got resolved */
    public int resolve() {
        List<Issue> unresolved = store.selectPolicyZoneUnresolved();
        log.info("{} issue(s) with an unknown policy zone", unresolved.size());

        int resolved = 0;
        for (Issue issue : unresolved) {
            Boolean inZone = spatialService.isInPolicyZone(issue.getLatitude(), issue.getLongitude());
            if (inZone == null) {
                log.debug("Policy zone of issue {} still undecided", issue.getExternalKey());
                continue;
            }
            issue.setPolicyZone(PolicyZone.fromStoredValue(inZone));
            store.persist(issue);
            resolved++;
        }
        log.info("Policy zone resolved for {} of {} issue(s)", resolved, unresolved.size());
        return resolved;
    }
}
