package com.geointel.reporter.service;

import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.exception.IssueInvariantException;
import com.geointel.reporter.model.ClusterAssignment;
import com.geointel.reporter.model.ClusterCandidate;
import com.geointel.reporter.model.Issue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sends a batch of issues to the spatial service for clustering and reattaches
 * the answer to the in-memory issues.
 *
 * The output follows the spatial service's row order, which keeps the members of a
 * cluster contiguous; report emission relies on that order and nothing here re-sorts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClusterCorrelationService {

    private final SpatialReferenceService spatialService;
    private final SketchFactory sketchFactory;

    /**
     * @return the issues in clustering order, each carrying its cluster key and sketch
     *         (both null for standalone issues)
     * @throws DataContractViolationException when the clustering rows break their contract
     * @throws IssueInvariantException when the batch holds the same issue twice
     */
    public List<Issue> correlate(List<Issue> issues) {
        if (issues.isEmpty()) return Collections.emptyList();

        Map<String, Issue> byKey = new LinkedHashMap<>();
        for (Issue issue : issues) {
            if (byKey.put(issue.getExternalKey(), issue) != null) {
                throw new IssueInvariantException(issue.getExternalKey(), "appears twice in the clustering batch");
            }
        }

        List<ClusterCandidate> candidates = issues.stream().map(ClusterCandidate::of).toList();
        List<ClusterAssignment> rows = spatialService.clusterize(candidates);

        List<Issue> ordered = new ArrayList<>(rows.size());
        Set<String> seenKeys = new HashSet<>();
        Set<String> seenClusters = new HashSet<>();
        String previousCluster = null;

        for (ClusterAssignment row : rows) {
            Issue issue = byKey.get(row.key());
            if (issue == null) {
                throw new DataContractViolationException("Clustering returned unknown issue key " + row.key());
            }
            if (!seenKeys.add(row.key())) {
                throw new DataContractViolationException("Clustering returned issue " + row.key() + " twice");
            }

            if (row.isClustered()) {
                if (row.boundingGeometry() == null || row.centroidLat() == null || row.centroidLon() == null) {
                    throw new DataContractViolationException(
                            "Cluster " + row.clusterKey() + " returned without footprint for issue " + row.key());
                }
                if (!row.clusterKey().equals(previousCluster) && !seenClusters.add(row.clusterKey())) {
                    throw new DataContractViolationException(
                            "Members of cluster " + row.clusterKey() + " are not contiguous (issue " + row.key() + ")");
                }
                issue.setClusterKey(row.clusterKey());
                issue.setSketch(sketchFactory.build(row));
            } else {
                // stale values from an earlier, interrupted run
                issue.setClusterKey(null);
                issue.setSketch(null);
            }
            previousCluster = row.clusterKey();
            ordered.add(issue);
        }

        int dropped = issues.size() - ordered.size();
        if (dropped > 0) {
            log.warn("{} issue(s) missing from the clustering answer are left out of this run", dropped);
        }
        long clusters = ordered.stream().map(Issue::getClusterKey).filter(Objects::nonNull).distinct().count();
        log.info("Correlated {} issue(s) into {} cluster(s)", ordered.size(), clusters);
        return ordered;
    }
}
