package com.geointel.reporter.store;

import com.geointel.reporter.model.Issue;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable inventory of issues, keyed by external key.
 */
public interface IssueStore {

    /** Creates the schema when missing. Idempotent. */
    void ensureSchema();

    /** Issues without a report reference and resolved as outside any policy zone. */
    List<Issue> selectEligible();

    /** Issues holding a report reference whose status is one of the given values. */
    List<Issue> selectUnclosed(Collection<String> unclosedStatuses);

    /** Issues whose policy-zone flag is still unknown. */
    List<Issue> selectPolicyZoneUnresolved();

    Optional<Issue> findByKey(String externalKey);

    /** Atomic upsert by external key: all fields of the issue land in one write. */
    void persist(Issue issue);
}
