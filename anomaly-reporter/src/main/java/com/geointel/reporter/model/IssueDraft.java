package com.geointel.reporter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching one entry of the feed's issues.json response.
 * Kept separate from {@link Issue} to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueDraft {

    private String id;

    private Integer source;

    private Integer item;

    @JsonProperty("class")
    private Integer classId;

    private Integer level;

    private Subtitle subtitle;

    /** e.g. "2024-05-02 10:21:45+00:00" */
    private String update;

    private List<String> usernames;

    private String lat;

    private String lon;

    @JsonProperty("osm_ids")
    private JsonNode osmIds;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Subtitle {
        private String auto;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Page {
        private List<IssueDraft> issues;
    }
}
