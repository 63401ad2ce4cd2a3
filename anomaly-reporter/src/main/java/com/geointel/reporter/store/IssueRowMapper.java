package com.geointel.reporter.store;

import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.PolicyZone;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Maps anomaly_issue rows to {@link Issue} and back.
 * Parameter names are the column names.
 */
class IssueRowMapper implements RowMapper<Issue> {

    @Override
    public Issue mapRow(ResultSet rs, int rowNum) throws SQLException {
        String feedStatus = rs.getString("feed_status");
        return Issue.builder()
                .externalKey(rs.getString("external_key"))
                .feedStatus(feedStatus == null ? null : FeedStatus.fromCode(feedStatus))
                .source(getInt(rs, "feed_source"))
                .level(getInt(rs, "severity_level"))
                .country(rs.getString("country"))
                .usernames(rs.getString("usernames"))
                .osmElements(rs.getString("osm_elements"))
                .feedUpdatedAt(getDateTime(rs, "feed_updated_at"))
                .itemId(getInt(rs, "item_id"))
                .classId(getInt(rs, "class_id"))
                .itemNameEn(rs.getString("item_name_en"))
                .itemNameFr(rs.getString("item_name_fr"))
                .classTitleEn(rs.getString("class_title_en"))
                .classTitleFr(rs.getString("class_title_fr"))
                .subtitle(rs.getString("subtitle"))
                .theme(rs.getString("theme"))
                .referenceClass(rs.getString("reference_class"))
                .latitude(getDouble(rs, "latitude"))
                .longitude(getDouble(rs, "longitude"))
                .minLat(getDouble(rs, "min_lat"))
                .maxLat(getDouble(rs, "max_lat"))
                .minLon(getDouble(rs, "min_lon"))
                .maxLon(getDouble(rs, "max_lon"))
                .detectedAt(getDateTime(rs, "detected_at"))
                .description(rs.getString("description"))
                .collector(rs.getString("collector"))
                .communeCode(rs.getString("commune_code"))
                .communeName(rs.getString("commune_name"))
                .cantonCode(rs.getString("canton_code"))
                .arrondissementCode(rs.getString("arrondissement_code"))
                .arrondissementName(rs.getString("arrondissement_name"))
                .collectivityCode(rs.getString("collectivity_code"))
                .collectivityName(rs.getString("collectivity_name"))
                .departmentCode(rs.getString("department_code"))
                .departmentName(rs.getString("department_name"))
                .regionCode(rs.getString("region_code"))
                .regionName(rs.getString("region_name"))
                .territoryName(rs.getString("territory_name"))
                .territorySrid(getInt(rs, "territory_srid"))
                .projectedX(getDouble(rs, "projected_x"))
                .projectedY(getDouble(rs, "projected_y"))
                .referenceObjectId(rs.getString("reference_object_id"))
                .attribute1(rs.getString("attribute_1"))
                .attribute2(rs.getString("attribute_2"))
                .attribute3(rs.getString("attribute_3"))
                .attribute4(rs.getString("attribute_4"))
                .attribute5(rs.getString("attribute_5"))
                .referenceModifiedAt(rs.getString("reference_modified_at"))
                .policyZone(PolicyZone.fromStoredValue(getBoolean(rs, "policy_excluded")))
                .clusterKey(rs.getString("cluster_key"))
                .sketch(rs.getString("sketch"))
                .reportRef(getLong(rs, "report_ref"))
                .reportStatus(rs.getString("report_status"))
                .statusRefreshedAt(getDateTime(rs, "status_refreshed_at"))
                .ingestedAt(getDateTime(rs, "ingested_at"))
                .build();
    }

    static MapSqlParameterSource toParameters(Issue i) {
        return new MapSqlParameterSource()
                .addValue("external_key", i.getExternalKey())
                .addValue("feed_status", i.getFeedStatus() == null ? null : i.getFeedStatus().getCode())
                .addValue("feed_source", i.getSource())
                .addValue("severity_level", i.getLevel())
                .addValue("country", i.getCountry())
                .addValue("usernames", i.getUsernames())
                .addValue("osm_elements", i.getOsmElements())
                .addValue("feed_updated_at", timestamp(i.getFeedUpdatedAt()))
                .addValue("item_id", i.getItemId())
                .addValue("class_id", i.getClassId())
                .addValue("item_name_en", i.getItemNameEn())
                .addValue("item_name_fr", i.getItemNameFr())
                .addValue("class_title_en", i.getClassTitleEn())
                .addValue("class_title_fr", i.getClassTitleFr())
                .addValue("subtitle", i.getSubtitle())
                .addValue("theme", i.getTheme())
                .addValue("reference_class", i.getReferenceClass())
                .addValue("latitude", i.getLatitude())
                .addValue("longitude", i.getLongitude())
                .addValue("min_lat", i.getMinLat())
                .addValue("max_lat", i.getMaxLat())
                .addValue("min_lon", i.getMinLon())
                .addValue("max_lon", i.getMaxLon())
                .addValue("detected_at", timestamp(i.getDetectedAt()))
                .addValue("description", i.getDescription())
                .addValue("collector", i.getCollector())
                .addValue("commune_code", i.getCommuneCode())
                .addValue("commune_name", i.getCommuneName())
                .addValue("canton_code", i.getCantonCode())
                .addValue("arrondissement_code", i.getArrondissementCode())
                .addValue("arrondissement_name", i.getArrondissementName())
                .addValue("collectivity_code", i.getCollectivityCode())
                .addValue("collectivity_name", i.getCollectivityName())
                .addValue("department_code", i.getDepartmentCode())
                .addValue("department_name", i.getDepartmentName())
                .addValue("region_code", i.getRegionCode())
                .addValue("region_name", i.getRegionName())
                .addValue("territory_name", i.getTerritoryName())
                .addValue("territory_srid", i.getTerritorySrid())
                .addValue("projected_x", i.getProjectedX())
                .addValue("projected_y", i.getProjectedY())
                .addValue("reference_object_id", i.getReferenceObjectId())
                .addValue("attribute_1", i.getAttribute1())
                .addValue("attribute_2", i.getAttribute2())
                .addValue("attribute_3", i.getAttribute3())
                .addValue("attribute_4", i.getAttribute4())
                .addValue("attribute_5", i.getAttribute5())
                .addValue("reference_modified_at", i.getReferenceModifiedAt())
                .addValue("policy_excluded", i.getPolicyZone() == null ? null : i.getPolicyZone().toStoredValue())
                .addValue("cluster_key", i.getClusterKey())
                .addValue("sketch", i.getSketch())
                .addValue("report_ref", i.getReportRef())
                .addValue("report_status", i.getReportStatus())
                .addValue("status_refreshed_at", timestamp(i.getStatusRefreshedAt()))
                .addValue("ingested_at", timestamp(i.getIngestedAt()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Timestamp timestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    private static LocalDateTime getDateTime(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toLocalDateTime();
    }

    private static Integer getInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Boolean getBoolean(ResultSet rs, String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? null : value;
    }
}
