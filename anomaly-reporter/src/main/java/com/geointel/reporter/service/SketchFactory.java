package com.geointel.reporter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.ReporterException;
import com.geointel.reporter.model.ClusterAssignment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the sketch annotation attached to a cluster report: the cluster footprint
 * as one polygon, and the map context centred on it.
 */
@Component
@RequiredArgsConstructor
public class SketchFactory {

    private static final String POLYGON_TYPE = "Polygone";

    private final ObjectMapper objectMapper;
    private final ReporterProperties properties;

    public String build(ClusterAssignment assignment) {
        ReporterProperties.Report report = properties.getReport();

        ObjectNode sketch = objectMapper.createObjectNode();
        sketch.put("desc", report.getSketchLabel());
        sketch.put("name", report.getSketchLabel());

        ObjectNode polygon = sketch.putArray("objects").addObject();
        polygon.put("type", POLYGON_TYPE);
        polygon.put("geometry", assignment.boundingGeometry());
        polygon.putObject("attributes");

        // the reporting UI reads context coordinates as strings
        ObjectNode context = sketch.putObject("contexte");
        context.put("lat", String.valueOf(assignment.centroidLat()));
        context.put("lon", String.valueOf(assignment.centroidLon()));
        context.put("zoom", report.getSketchZoom());

        try {
            return objectMapper.writeValueAsString(sketch);
        } catch (JsonProcessingException e) {
            throw new ReporterException("Could not serialise sketch of cluster " + assignment.clusterKey(), e);
        }
    }
}
