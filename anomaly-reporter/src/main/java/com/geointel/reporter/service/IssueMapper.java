package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.config.ReporterProperties.ClassDefinition;
import com.geointel.reporter.config.ReporterProperties.ItemDefinition;
import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.model.AdministrativeUnit;
import com.geointel.reporter.model.FeedQuery;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.IssueDetail;
import com.geointel.reporter.model.IssueDraft;
import com.geointel.reporter.model.ReferenceObject;
import com.geointel.reporter.model.Territory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Maps raw feed drafts to the {@link Issue} domain model and folds
 * reference-geography lookups into it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IssueMapper {

    /** e.g. "2024-05-02 10:21:45+00:00" */
    private static final DateTimeFormatter FEED_UPDATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssXXX");

    private final ReporterProperties properties;

    /**
     * Convert one feed draft to a new Issue, labelled from the item catalog.
     *
     * @param raw   draft as returned by the feed
     * @param query query the draft answered, gives country and status
     */
    public Issue map(IssueDraft raw, FeedQuery query) {
        if (raw.getId() == null || raw.getId().isBlank()) {
            throw new DataContractViolationException("Feed issue without id");
        }
        int itemId = raw.getItem() != null ? raw.getItem() : query.getItemId();
        int classId = raw.getClassId() != null ? raw.getClassId() : query.getClassId();

        Issue.IssueBuilder builder = Issue.builder()
                .externalKey(raw.getId())
                .feedStatus(query.getStatus())
                .source(raw.getSource())
                .level(raw.getLevel())
                .country(query.getCountry())
                .usernames(raw.getUsernames() == null ? null : String.join(",", raw.getUsernames()))
                .osmElements(raw.getOsmIds() == null || raw.getOsmIds().isNull() ? null : raw.getOsmIds().toString())
                .feedUpdatedAt(parseUpdate(raw.getUpdate()))
                .itemId(itemId)
                .classId(classId)
                .subtitle(raw.getSubtitle() == null ? null : emptyToNull(raw.getSubtitle().getAuto()))
                .latitude(parseCoordinate(raw.getLat(), "lat", raw.getId()))
                .longitude(parseCoordinate(raw.getLon(), "lon", raw.getId()));

        ItemDefinition item = properties.getItems().get(itemId);
        if (item == null) {
            log.warn("Item {} of issue {} is not in the catalog, labels left empty", itemId, raw.getId());
        } else {
            builder.itemNameEn(item.getNameEn())
                    .itemNameFr(item.getNameFr())
                    .theme(item.getTheme())
                    .referenceClass(item.getReferenceClass());
            ClassDefinition itemClass = item.getClasses().get(classId);
            if (itemClass == null) {
                log.warn("Class {} of item {} is not in the catalog (issue {})", classId, itemId, raw.getId());
            } else {
                builder.classTitleEn(itemClass.getTitleEn())
                        .classTitleFr(itemClass.getTitleFr());
            }
        }
        return builder.build();
    }

    public void applyDetail(Issue issue, IssueDetail detail) {
        if (detail == null) return;
        issue.setMinLat(detail.minLat());
        issue.setMaxLat(detail.maxLat());
        issue.setMinLon(detail.minLon());
        issue.setMaxLon(detail.maxLon());
        issue.setDetectedAt(detail.detectedAt());
    }

    public void applyAdministrativeUnit(Issue issue, AdministrativeUnit unit) {
        if (unit == null) return;
        issue.setCommuneCode(unit.communeCode());
        issue.setCommuneName(unit.communeName());
        issue.setCantonCode(unit.cantonCode());
        issue.setArrondissementCode(unit.arrondissementCode());
        issue.setArrondissementName(unit.arrondissementName());
        issue.setCollectivityCode(unit.collectivityCode());
        issue.setCollectivityName(unit.collectivityName());
        issue.setDepartmentCode(unit.departmentCode());
        issue.setDepartmentName(unit.departmentName());
        issue.setRegionCode(unit.regionCode());
        issue.setRegionName(unit.regionName());
    }

    public void applyTerritory(Issue issue, Territory territory) {
        if (territory == null) return;
        issue.setTerritoryName(territory.name());
        issue.setTerritorySrid(territory.srid());
        issue.setProjectedX(territory.x());
        issue.setProjectedY(territory.y());
    }

    public void applyReferenceObject(Issue issue, ReferenceObject object) {
        if (object == null) return;
        issue.setReferenceObjectId(object.id());
        issue.setAttribute1(object.attribute1());
        issue.setAttribute2(object.attribute2());
        issue.setAttribute3(object.attribute3());
        issue.setAttribute4(object.attribute4());
        issue.setAttribute5(object.attribute5());
        issue.setReferenceModifiedAt(object.modifiedAt());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LocalDateTime parseUpdate(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value, FEED_UPDATE).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Could not parse feed update timestamp: {}", value);
            return null;
        }
    }

    private double parseCoordinate(String value, String field, String key) {
        if (value == null || value.isBlank()) {
            throw new DataContractViolationException("Feed issue " + key + " has no " + field);
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new DataContractViolationException("Feed issue " + key + " has a malformed " + field + ": " + value, e);
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
