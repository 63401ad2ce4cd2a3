package com.geointel.reporter.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.model.FeedQuery;
import com.geointel.reporter.model.IssueDetail;
import com.geointel.reporter.model.IssueDraft;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the Osmose QA REST API (version 0.3).
 *
 * Reads are idempotent: a 429 or 5xx triggers the Resilience4j retry with exponential backoff.
 * Pacing between calls is up to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OsmoseFeedClient implements IssueFeedClient {

    private final RestTemplate restTemplate;
    private final ReporterProperties properties;

    /**
     * Fetch the issues of one item class in one country area.
     * The country is matched as a prefix, "france" covers every "france_*" area.
     */
    @Override
    @Retry(name = "issueFeed")
    public List<IssueDraft> fetch(FeedQuery query) {
        ReporterProperties.Feed feed = properties.getFeed();
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(feed.getBaseUrl() + "/issues.json")
                .queryParam("limit", feed.getLimit())
                .queryParam("country", query.getCountry() + "*")
                .queryParam("full", feed.isFull())
                .queryParam("status", query.getStatus().getCode())
                .queryParam("useDevItem", query.getUseDevItem())
                .queryParam("item", query.getItemId())
                .queryParam("class", query.getClassId());
        if (query.getStartDate() != null) builder.queryParam("start_date", query.getStartDate());
        if (query.getEndDate() != null) builder.queryParam("end_date", query.getEndDate());
        if (query.getSource() != null && !query.getSource().isBlank() && !"*".equals(query.getSource())) {
            builder.queryParam("source", query.getSource());
        }
        URI uri = builder.build().encode().toUri();

        log.debug("Calling issue feed: {}", uri);
        try {
            IssueDraft.Page page = restTemplate.getForObject(uri, IssueDraft.Page.class);
            if (page == null || page.getIssues() == null) {
                return Collections.emptyList();
            }
            log.debug("Feed returned {} issues for {}", page.getIssues().size(), uri);
            return page.getIssues();

        } catch (HttpClientErrorException.NotFound e) {
            // 404 means nothing published for that combination
            log.debug("No issues found (404) for {}", uri);
            return Collections.emptyList();

        } catch (Exception e) {
            log.error("Feed call failed for {}: {}", uri, e.getMessage());
            throw e;
        }
    }

    @Override
    @Retry(name = "issueFeed")
    public IssueDetail fetchDetail(String externalKey) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getFeed().getBaseUrl() + "/false-positive/{key}")
                .buildAndExpand(externalKey)
                .encode()
                .toUri();

        log.debug("Calling issue detail: {}", uri);
        JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
        if (body == null || !body.isObject()) {
            throw new DataContractViolationException("Empty detail returned for issue " + externalKey);
        }
        return new IssueDetail(
                decimal(body, "minlat"),
                decimal(body, "maxlat"),
                decimal(body, "minlon"),
                decimal(body, "maxlon"),
                timestamp(body, "date", externalKey));
    }

    @Override
    @Retry(name = "issueFeed")
    public List<String> fetchCountries() {
        String url = properties.getFeed().getBaseUrl() + "/countries";
        JsonNode body = restTemplate.getForObject(url, JsonNode.class);
        if (body == null || !body.path("countries").isArray()) {
            throw new DataContractViolationException("Country list missing from " + url);
        }
        List<String> countries = new ArrayList<>();
        body.get("countries").forEach(c -> countries.add(c.asText()));
        log.debug("Feed knows {} countries", countries.size());
        return countries;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static Double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asDouble();
    }

    /** e.g. "2023-03-12T08:41:12.123456+00:00" */
    private static LocalDateTime timestamp(JsonNode node, String field, String externalKey) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        try {
            return OffsetDateTime.parse(value.asText()).toLocalDateTime();
        } catch (DateTimeParseException e) {
            throw new DataContractViolationException(
                    "Malformed " + field + " '" + value.asText() + "' for issue " + externalKey, e);
        }
    }
}
