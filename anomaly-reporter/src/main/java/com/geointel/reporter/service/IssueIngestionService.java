package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.config.ReporterProperties.ItemDefinition;
import com.geointel.reporter.model.FeedQuery;
import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.IssueDraft;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.model.RunRequest;
import com.geointel.reporter.store.IssueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects issues from the feed, keeps those the store does not know yet,
 * enriches them from the reference geography and stores them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IssueIngestionService {

    private static final List<String> ALL_SOURCES = List.of("*");

    private final IssueFeedClient feedClient;
    private final SpatialReferenceService spatialService;
    private final IssueStore store;
    private final IssueMapper mapper;
    private final ReporterProperties properties;
    private final CallPacer pacer;

    public IngestionResult ingest(RunRequest request) {
        Map<String, Issue> collected = new LinkedHashMap<>();
        List<Issue> fresh = new ArrayList<>();

        List<String> sources = request.getSources().isEmpty() ? ALL_SOURCES : request.getSources();
        for (String country : request.getCountries()) {
            for (String source : sources) {
                for (Integer itemId : request.getItems()) {
                    ItemDefinition item = catalogItem(itemId);
                    for (Integer classId : item.getClasses().keySet()) {
                        FeedQuery query = FeedQuery.builder()
                                .country(country)
                                .source(source)
                                .itemId(itemId)
                                .classId(classId)
                                .status(request.getFeedStatus())
                                .startDate(request.getStartDate())
                                .endDate(request.getEndDate())
                                .useDevItem(request.getUseDevItem())
                                .build();
                        List<IssueDraft> drafts = feedClient.fetch(query);
                        pacer.pause();
                        log.info("{} issue(s) for country {} source {} item {} class {}",
                                drafts.size(), country, source, itemId, classId);

                        for (IssueDraft draft : drafts) {
                            Issue issue = mapper.map(draft, query);
                            if (collected.putIfAbsent(issue.getExternalKey(), issue) == null
                                    && store.findByKey(issue.getExternalKey()).isEmpty()) {
                                fresh.add(issue);
                            }
                        }
                    }
                }
            }
        }
        log.info("{} issue(s) collected, {} unknown to the store", collected.size(), fresh.size());

        if (request.getFeedStatus() != FeedStatus.FALSE_POSITIVE) {
            log.info("Requested feed status is '{}', nothing to persist", request.getFeedStatus().getCode());
            return new IngestionResult(collected.size(), fresh.size(), 0);
        }

        int persisted = 0;
        for (Issue issue : fresh) {
            if (enrich(issue, request)) {
                store.persist(issue);
                persisted++;
            }
        }
        log.info("{} new issue(s) inside the requested area persisted", persisted);
        return new IngestionResult(collected.size(), fresh.size(), persisted);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Fills the issue from detail and reference lookups. False when it falls outside the spatial filter. */
    private boolean enrich(Issue issue, RunRequest request) {
        double lat = issue.getLatitude();
        double lon = issue.getLongitude();

        if (issue.getFeedStatus() == FeedStatus.FALSE_POSITIVE) {
            mapper.applyDetail(issue, feedClient.fetchDetail(issue.getExternalKey()));
            pacer.pause();
        }

        mapper.applyAdministrativeUnit(issue, spatialService.lookupAdministrativeUnit(lat, lon));
        issue.setCollector(spatialService.lookupCollector(lat, lon));
        if (!request.acceptsLocation(issue)) {
            log.debug("Issue {} outside the requested departments/regions, skipped", issue.getExternalKey());
            return false;
        }

        mapper.applyTerritory(issue, spatialService.lookupTerritory(lat, lon));
        mapper.applyReferenceObject(issue,
                spatialService.lookupReferenceObject(lat, lon, catalogItem(issue.getItemId())));
        issue.setPolicyZone(PolicyZone.UNKNOWN);
        pacer.pause();
        return true;
    }

    private ItemDefinition catalogItem(Integer itemId) {
        ItemDefinition item = properties.getItems().get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Item " + itemId + " is not in the catalog");
        }
        return item;
    }
}
