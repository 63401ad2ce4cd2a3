package com.geointel.reporter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.config.ReporterProperties.ItemDefinition;
import com.geointel.reporter.exception.ReporterException;
import com.geointel.reporter.model.AdministrativeUnit;
import com.geointel.reporter.model.ClusterAssignment;
import com.geointel.reporter.model.ClusterCandidate;
import com.geointel.reporter.model.ReferenceObject;
import com.geointel.reporter.model.Territory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reference geography served by a PostGIS database.
 *
 * Table and column names come from configuration and are checked against a strict
 * identifier pattern before being inlined; every value goes through bind parameters.
 */
@Service
@Slf4j
public class PostgisReferenceService implements SpatialReferenceService {

    static final String UNKNOWN_COLLECTOR = "Collecteur inconnu";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    /** WGS84 input point, reprojected into the SRID of the geometry it is compared with. */
    private static final String POINT = "ST_SetSRID(ST_MakePoint(:lon, :lat), 4326)";

    private final NamedParameterJdbcTemplate jdbc;
    private final ReporterProperties properties;
    private final ObjectMapper objectMapper;

    public PostgisReferenceService(@Qualifier("referenceJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                   ReporterProperties properties,
                                   ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ── Clustering ───────────────────────────────────────────────────────────

    @Override
    public List<ClusterAssignment> clusterize(List<ClusterCandidate> candidates) {
        if (candidates.isEmpty()) return Collections.emptyList();
        ReporterProperties.Reference ref = properties.getReference();

        // DBSCAN runs in a metric projection, eps is in metres.
        // A missing attribute and an empty one share a partition, as they share a cluster key.
        String sql = """
            WITH candidate AS (
                SELECT c.key, c.item_id, c.class_id, COALESCE(c.attribute_1, '') AS attribute_1,
                       ST_Transform(ST_SetSRID(ST_MakePoint(c.lon, c.lat), 4326), :srid) AS geom
                FROM json_to_recordset(CAST(:candidates AS json))
                     AS c(key text, lat double precision, lon double precision,
                          item_id integer, class_id integer, attribute_1 text)
            ),
            clustered AS (
                SELECT candidate.*,
                       ST_ClusterDBSCAN(geom, eps := :eps, minpoints := :minPoints)
                           OVER (PARTITION BY item_id, class_id, attribute_1) AS raw_cluster
                FROM candidate
            ),
            keyed AS (
                SELECT clustered.*,
                       CASE WHEN raw_cluster IS NULL THEN NULL
                            ELSE item_id || '_' || class_id || '_' || attribute_1 || '_' || raw_cluster
                       END AS cluster_key
                FROM clustered
            ),
            footprint AS (
                SELECT cluster_key, ST_Envelope(ST_Collect(geom)) AS envelope
                FROM keyed
                WHERE cluster_key IS NOT NULL
                GROUP BY cluster_key
            )
            SELECT k.key,
                   k.cluster_key,
                   ST_AsText(ST_Transform(f.envelope, 4326))            AS bounding_geometry,
                   ST_X(ST_Transform(ST_Centroid(f.envelope), 4326))    AS centroid_lon,
                   ST_Y(ST_Transform(ST_Centroid(f.envelope), 4326))    AS centroid_lat
            FROM keyed k
            LEFT JOIN footprint f ON f.cluster_key = k.cluster_key
            ORDER BY k.cluster_key NULLS LAST, ST_Distance(k.geom, ST_Centroid(f.envelope)), k.key
        """;

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("candidates", toJson(candidates))
                .addValue("srid", ref.getMetricSrid())
                .addValue("eps", ref.getClusterDistance())
                .addValue("minPoints", ref.getClusterMinPoints());

        List<ClusterAssignment> rows = jdbc.query(sql, params, (rs, i) -> new ClusterAssignment(
                rs.getString("key"),
                rs.getString("cluster_key"),
                rs.getString("bounding_geometry"),
                getDouble(rs, "centroid_lon"),
                getDouble(rs, "centroid_lat")));
        log.debug("Clustering returned {} rows for {} candidates", rows.size(), candidates.size());
        return rows;
    }

    // ── Administrative geography ─────────────────────────────────────────────

    @Override
    public AdministrativeUnit lookupAdministrativeUnit(double latitude, double longitude) {
        ReporterProperties.Reference ref = properties.getReference();
        String sql = "SELECT c.code_insee AS commune_code, c.nom_officiel AS commune_name,"
                + " c.code_insee_du_canton AS canton_code,"
                + " a.code_insee AS arrondissement_code, a.nom_officiel AS arrondissement_name,"
                + " t.code_insee AS collectivity_code, t.nom_officiel AS collectivity_name,"
                + " d.code_insee AS department_code, d.nom_officiel AS department_name,"
                + " r.code_insee AS region_code, r.nom_officiel AS region_name"
                + " FROM " + identifier(ref.getCommuneTable()) + " c"
                + " LEFT JOIN " + identifier(ref.getArrondissementTable()) + " a"
                + "   ON a.code_insee = c.code_insee_de_l_arrondissement"
                + " LEFT JOIN " + identifier(ref.getCollectivityTable()) + " t"
                + "   ON t.code_insee = c.code_insee_de_la_collectivite_terr"
                + " LEFT JOIN " + identifier(ref.getDepartmentTable()) + " d"
                + "   ON d.code_insee = c.code_insee_du_departement"
                + " LEFT JOIN " + identifier(ref.getRegionTable()) + " r"
                + "   ON r.code_insee = c.code_insee_de_la_region"
                + " WHERE ST_Intersects(c.geometrie, ST_Transform(" + POINT + ", ST_SRID(c.geometrie)))"
                + " LIMIT 1";

        List<AdministrativeUnit> found = jdbc.query(sql, point(latitude, longitude), (rs, i) -> new AdministrativeUnit(
                rs.getString("commune_code"),
                rs.getString("commune_name"),
                rs.getString("canton_code"),
                rs.getString("arrondissement_code"),
                rs.getString("arrondissement_name"),
                rs.getString("collectivity_code"),
                rs.getString("collectivity_name"),
                rs.getString("department_code"),
                rs.getString("department_name"),
                rs.getString("region_code"),
                rs.getString("region_name")));
        if (found.isEmpty()) {
            log.warn("No commune at lat={} lon={}, point outside the covered territory", latitude, longitude);
            return null;
        }
        return found.get(0);
    }

    @Override
    public String lookupCollector(double latitude, double longitude) {
        String table = identifier(properties.getReference().getCollectorTable());
        List<String> found = jdbc.queryForList(
                "SELECT z.collecteur FROM " + table + " z"
                        + " WHERE ST_Intersects(z.geometrie, ST_Transform(" + POINT + ", ST_SRID(z.geometrie)))"
                        + " LIMIT 1",
                point(latitude, longitude), String.class);
        if (found.isEmpty() || found.get(0) == null) {
            log.warn("No collector zone at lat={} lon={}", latitude, longitude);
            return UNKNOWN_COLLECTOR;
        }
        return found.get(0);
    }

    @Override
    public Territory lookupTerritory(double latitude, double longitude) {
        String table = identifier(properties.getReference().getTerritoryTable());
        List<Territory> found = jdbc.query(
                "SELECT t.nom, t.srid,"
                        + " ST_X(ST_Transform(" + POINT + ", t.srid)) AS x,"
                        + " ST_Y(ST_Transform(" + POINT + ", t.srid)) AS y"
                        + " FROM " + table + " t"
                        + " WHERE ST_Intersects(t.geometrie, ST_Transform(" + POINT + ", ST_SRID(t.geometrie)))"
                        + " LIMIT 1",
                point(latitude, longitude),
                (rs, i) -> new Territory(
                        rs.getString("nom"),
                        rs.getObject("srid", Integer.class),
                        getDouble(rs, "x"),
                        getDouble(rs, "y")));
        if (found.isEmpty()) {
            log.warn("No territory at lat={} lon={}", latitude, longitude);
            return null;
        }
        return found.get(0);
    }

    @Override
    public ReferenceObject lookupReferenceObject(double latitude, double longitude, ItemDefinition item) {
        ReporterProperties.Reference ref = properties.getReference();
        String geometry = "o." + identifier(item.getGeometryColumn());

        StringBuilder columns = new StringBuilder("o.cleabs::text AS id");
        for (int i = 0; i < 5; i++) {
            String attribute = item.attributeName(i);
            columns.append(", ")
                    .append(attribute == null ? "NULL" : "o." + identifier(attribute) + "::text")
                    .append(" AS attribute_").append(i + 1);
        }
        columns.append(", o.gcms_date_modification::text AS modified_at");

        String metricPoint = "ST_Transform(" + POINT + ", :srid)";
        String sql = "SELECT " + columns
                + " FROM " + identifier(item.getReferenceClass()) + " o"
                + " WHERE ST_DWithin(ST_Transform(" + geometry + ", :srid), " + metricPoint + ", :radius)"
                + " ORDER BY ST_Distance(ST_Transform(" + geometry + ", :srid), " + metricPoint + ")"
                + " LIMIT 1";

        MapSqlParameterSource params = point(latitude, longitude)
                .addValue("srid", ref.getMetricSrid())
                .addValue("radius", ref.getObjectSearchRadius());

        List<ReferenceObject> found = jdbc.query(sql, params, (rs, i) -> new ReferenceObject(
                rs.getString("id"),
                rs.getString("attribute_1"),
                rs.getString("attribute_2"),
                rs.getString("attribute_3"),
                rs.getString("attribute_4"),
                rs.getString("attribute_5"),
                rs.getString("modified_at")));
        if (found.isEmpty()) {
            log.debug("No {} object within {} m of lat={} lon={}",
                    item.getReferenceClass(), ref.getObjectSearchRadius(), latitude, longitude);
            return null;
        }
        return found.get(0);
    }

    // ── Policy zones ─────────────────────────────────────────────────────────

    /**
     * Null when the point lies outside every territory: the zone layer does not cover it
     * and nothing can be said.
     */
    @Override
    public Boolean isInPolicyZone(double latitude, double longitude) {
        ReporterProperties.Reference ref = properties.getReference();
        String sql = "SELECT CASE WHEN NOT EXISTS ("
                + "   SELECT 1 FROM " + identifier(ref.getTerritoryTable()) + " t"
                + "   WHERE ST_Intersects(t.geometrie, ST_Transform(" + POINT + ", ST_SRID(t.geometrie))))"
                + " THEN NULL"
                + " ELSE EXISTS ("
                + "   SELECT 1 FROM " + identifier(ref.getPolicyZoneTable()) + " z"
                + "   WHERE ST_Intersects(z.geometrie, ST_Transform(" + POINT + ", ST_SRID(z.geometrie))))"
                + " END";
        return jdbc.queryForObject(sql, point(latitude, longitude), Boolean.class);
    }

    // ── Filters ──────────────────────────────────────────────────────────────

    @Override
    public List<String> listDepartmentCodes() {
        ReporterProperties.Reference ref = properties.getReference();
        List<String> codes = new ArrayList<>(jdbc.getJdbcTemplate().queryForList(
                "SELECT code_insee FROM " + identifier(ref.getDepartmentTable()) + " ORDER BY code_insee",
                String.class));
        ref.getExtraDepartmentCodes().stream()
                .filter(code -> !codes.contains(code))
                .forEach(codes::add);
        return codes;
    }

    @Override
    public List<String> listRegionCodes() {
        return jdbc.getJdbcTemplate().queryForList(
                "SELECT code_insee FROM " + identifier(properties.getReference().getRegionTable())
                        + " ORDER BY code_insee",
                String.class);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static MapSqlParameterSource point(double latitude, double longitude) {
        return new MapSqlParameterSource()
                .addValue("lat", latitude)
                .addValue("lon", longitude);
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier in configuration: " + name);
        }
        return name;
    }

    private String toJson(List<ClusterCandidate> candidates) {
        List<Map<String, Object>> rows = new ArrayList<>(candidates.size());
        for (ClusterCandidate c : candidates) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("key", c.key());
            row.put("lat", c.latitude());
            row.put("lon", c.longitude());
            row.put("item_id", c.itemId());
            row.put("class_id", c.classId());
            row.put("attribute_1", c.attribute1() == null ? "" : c.attribute1());
            rows.add(row);
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new ReporterException("Could not serialise clustering candidates", e);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
