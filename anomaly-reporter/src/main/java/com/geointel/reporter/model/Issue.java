package com.geointel.reporter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One anomaly from the QA feed together with everything accumulated about it:
 * reference-geography enrichment, policy-zone resolution, clustering and report state.
 *
 * Schema design notes:
 *  - externalKey is the feed's own UUID and our primary key
 *  - attribute1 is the partition attribute used by clustering (e.g. road name)
 *  - reportRef is signed, see {@link ReportLink}
 *  - clusterKey and sketch are recomputed on every emission run and persisted for traceability
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Issue {

    // ── Source identifiers ──────────────────────────────────────────────────
    /** Stable UUID from the feed, immutable */
    private String externalKey;

    private FeedStatus feedStatus;

    /** Feed source number (analyser + area) */
    private Integer source;

    /** Severity, 1 to 3 */
    private Integer level;

    /** Feed country the issue was requested for */
    private String country;

    private String usernames;

    /** Raw JSON of the OSM element ids the issue refers to */
    private String osmElements;

    /** Feed update timestamp of the issue */
    private LocalDateTime feedUpdatedAt;

    // ── Classification ──────────────────────────────────────────────────────
    private Integer itemId;

    private Integer classId;

    private String itemNameEn;

    private String itemNameFr;

    private String classTitleEn;

    private String classTitleFr;

    private String subtitle;

    /** Reporting-service theme the item belongs to */
    private String theme;

    /** Reference table holding the counterpart objects of this item */
    private String referenceClass;

    // ── Location ────────────────────────────────────────────────────────────
    /** WGS84 */
    private Double latitude;

    /** WGS84 */
    private Double longitude;

    // ── Detail (false positives only) ───────────────────────────────────────
    private Double minLat;
    private Double maxLat;
    private Double minLon;
    private Double maxLon;

    /** Date the feed detected the inconsistency */
    private LocalDateTime detectedAt;

    /** Report message composed from everything above */
    private String description;

    // ── Reference geography ─────────────────────────────────────────────────
    private String collector;
    private String communeCode;
    private String communeName;
    private String cantonCode;
    private String arrondissementCode;
    private String arrondissementName;
    private String collectivityCode;
    private String collectivityName;
    private String departmentCode;
    private String departmentName;
    private String regionCode;
    private String regionName;
    private String territoryName;
    private Integer territorySrid;

    /** Coordinates in the territory's legal projection */
    private Double projectedX;
    private Double projectedY;

    /** Id of the matching reference object, null when none was found nearby */
    private String referenceObjectId;
    private String attribute1;
    private String attribute2;
    private String attribute3;
    private String attribute4;
    private String attribute5;
    private String referenceModifiedAt;

    @Builder.Default
    private PolicyZone policyZone = PolicyZone.UNKNOWN;

    // ── Clustering ──────────────────────────────────────────────────────────
    /** Deterministic key of the cluster, null for standalone issues */
    private String clusterKey;

    /** Sketch JSON annotating the cluster footprint, null unless clustered */
    private String sketch;

    // ── Report ──────────────────────────────────────────────────────────────
    /** Signed report reference, see {@link ReportLink} */
    private Long reportRef;

    /** Last known remote status, null for linked members */
    private String reportStatus;

    private LocalDateTime statusRefreshedAt;

    /** First time this issue was persisted */
    private LocalDateTime ingestedAt;

    public ReportLink getReportLink() {
        return reportRef == null ? null : ReportLink.fromStoredValue(reportRef);
    }

    public void setReportLink(ReportLink link) {
        this.reportRef = link == null ? null : link.storedValue();
    }

    public boolean isReported() {
        return reportRef != null;
    }

    public boolean isEligibleForReport() {
        return reportRef == null && policyZone == PolicyZone.NOT_EXCLUDED;
    }
}
