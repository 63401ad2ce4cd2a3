package com.geointel.reporter.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.exception.ReportingServiceException;
import com.geointel.reporter.model.ReportRequest;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Client of the collaborative space "reports" API.
 *
 * Creation is not idempotent and is never retried: a timeout after the server accepted
 * the report would otherwise file it twice. Status lookups are retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollaborativeReportClient implements ReportingClient {

    private static final String INPUT_DEVICE = "UNKNOWN";
    private static final String DEVICE_VERSION = "0.0";

    private final RestTemplate restTemplate;
    private final ReporterProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public long createReport(ReportRequest request) {
        ReporterProperties.Reporting reporting = properties.getReporting();
        ObjectNode body = buildBody(request, reporting.getCommunity());

        log.debug("Posting report at lon={} lat={} theme={} status={}",
                request.longitude(), request.latitude(), request.theme(), request.mode().getWireStatus());
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(reporting.getEndpoint(), HttpMethod.POST,
                    new HttpEntity<>(body, headers()), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            log.error("Report creation refused with HTTP {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new ReportingServiceException(e.getStatusCode().value(), e.getResponseBodyAsString());
        }

        if (response.getStatusCode().value() != HttpStatus.CREATED.value()) {
            throw new ReportingServiceException(response.getStatusCode().value(), String.valueOf(response.getBody()));
        }
        JsonNode created = response.getBody();
        if (created == null || !created.hasNonNull("id") || !created.get("id").canConvertToLong()) {
            throw new DataContractViolationException("Report created without a numeric id: " + created);
        }
        long id = created.get("id").asLong();
        log.debug("Report {} created", id);
        return id;
    }

    @Override
    @Retry(name = "reportStatus")
    public String getStatus(long reportId) {
        String url = properties.getReporting().getEndpoint() + "/" + reportId;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(headers()), JsonNode.class);
            JsonNode body = response.getBody();
            if (response.getStatusCode().value() != HttpStatus.OK.value() || body == null || !body.hasNonNull("status")) {
                log.debug("No status for report {} (HTTP {})", reportId, response.getStatusCode().value());
                return null;
            }
            return body.get("status").asText();

        } catch (HttpStatusCodeException e) {
            // Deleted or hidden reports answer 4xx, the status is simply unknown
            log.debug("No status for report {} (HTTP {})", reportId, e.getStatusCode().value());
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    ObjectNode buildBody(ReportRequest request, int community) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("community", community);
        body.put("geometry", "POINT(" + request.longitude() + " " + request.latitude() + ")");
        body.put("comment", request.message());
        body.put("status", request.mode().getWireStatus());
        body.put("input_device", INPUT_DEVICE);
        body.put("device_version", DEVICE_VERSION);

        ObjectNode attributes = body.putObject("attributes");
        attributes.put("community", community);
        attributes.put("theme", request.theme());
        attributes.putObject("attributes");

        // the API expects the sketch as a JSON document serialised into a string field
        if (request.sketch() != null) {
            body.put("sketch", request.sketch());
        }
        return body;
    }

    private HttpHeaders headers() {
        ReporterProperties.Reporting reporting = properties.getReporting();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (reporting.getLogin() != null) {
            headers.setBasicAuth(reporting.getLogin(), reporting.getPassword() == null ? "" : reporting.getPassword());
        }
        return headers;
    }
}
