package com.geointel.reporter.store;

import com.geointel.reporter.model.Issue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class JdbcIssueStore implements IssueStore {

    private static final String TABLE = "anomaly_issue";

    private static final List<String> COLUMNS = List.of(
            "external_key", "feed_status", "feed_source", "severity_level", "country", "usernames",
            "osm_elements", "feed_updated_at",
            "item_id", "class_id", "item_name_en", "item_name_fr", "class_title_en", "class_title_fr",
            "subtitle", "theme", "reference_class",
            "latitude", "longitude", "min_lat", "max_lat", "min_lon", "max_lon", "detected_at", "description",
            "collector", "commune_code", "commune_name", "canton_code", "arrondissement_code",
            "arrondissement_name", "collectivity_code", "collectivity_name", "department_code",
            "department_name", "region_code", "region_name", "territory_name", "territory_srid",
            "projected_x", "projected_y", "reference_object_id",
            "attribute_1", "attribute_2", "attribute_3", "attribute_4", "attribute_5", "reference_modified_at",
            "policy_excluded", "cluster_key", "sketch",
            "report_ref", "report_status", "status_refreshed_at", "ingested_at");

    /** Never rewritten once the row exists. */
    private static final List<String> INSERT_ONLY = List.of("external_key", "ingested_at");

    private static final String UPDATE_SQL = "UPDATE " + TABLE + " SET "
            + COLUMNS.stream()
                    .filter(c -> !INSERT_ONLY.contains(c))
                    .map(c -> c + " = :" + c)
                    .collect(Collectors.joining(", "))
            + " WHERE external_key = :external_key";

    private static final String INSERT_SQL = "INSERT INTO " + TABLE + " ("
            + String.join(", ", COLUMNS) + ") VALUES ("
            + COLUMNS.stream().map(c -> ":" + c).collect(Collectors.joining(", ")) + ")";

    private static final String ORDER = " ORDER BY ingested_at, external_key";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final IssueRowMapper rowMapper = new IssueRowMapper();

    public JdbcIssueStore(@Qualifier("storeJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                          TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void ensureSchema() {
        log.info("Ensuring issue store schema exists...");

        jdbc.getJdbcTemplate().execute("""
            CREATE TABLE IF NOT EXISTS anomaly_issue
            (
                external_key            VARCHAR(64) NOT NULL PRIMARY KEY,
                feed_status             VARCHAR(10) NOT NULL,
                feed_source             INTEGER,
                severity_level          INTEGER,
                country                 VARCHAR,
                usernames               VARCHAR,
                osm_elements            VARCHAR,
                feed_updated_at         TIMESTAMP,
                item_id                 INTEGER NOT NULL,
                class_id                INTEGER NOT NULL,
                item_name_en            VARCHAR,
                item_name_fr            VARCHAR,
                class_title_en          VARCHAR,
                class_title_fr          VARCHAR,
                subtitle                VARCHAR,
                theme                   VARCHAR,
                reference_class         VARCHAR,
                latitude                DOUBLE PRECISION NOT NULL,
                longitude               DOUBLE PRECISION NOT NULL,
                min_lat                 DOUBLE PRECISION,
                max_lat                 DOUBLE PRECISION,
                min_lon                 DOUBLE PRECISION,
                max_lon                 DOUBLE PRECISION,
                detected_at             TIMESTAMP,
                description             VARCHAR,
                collector               VARCHAR,
                commune_code            VARCHAR(5),
                commune_name            VARCHAR(80),
                canton_code             VARCHAR(5),
                arrondissement_code     VARCHAR(5),
                arrondissement_name     VARCHAR,
                collectivity_code       VARCHAR(5),
                collectivity_name       VARCHAR,
                department_code         VARCHAR(5),
                department_name         VARCHAR,
                region_code             VARCHAR(5),
                region_name             VARCHAR,
                territory_name          VARCHAR,
                territory_srid          INTEGER,
                projected_x             DOUBLE PRECISION,
                projected_y             DOUBLE PRECISION,
                reference_object_id     VARCHAR,
                attribute_1             VARCHAR,
                attribute_2             VARCHAR,
                attribute_3             VARCHAR,
                attribute_4             VARCHAR,
                attribute_5             VARCHAR,
                reference_modified_at   VARCHAR,
                policy_excluded         BOOLEAN,
                cluster_key             VARCHAR,
                sketch                  VARCHAR,
                report_ref              BIGINT,
                report_status           VARCHAR,
                status_refreshed_at     TIMESTAMP,
                ingested_at             TIMESTAMP NOT NULL
            )
        """);

        jdbc.getJdbcTemplate().execute(
                "CREATE INDEX IF NOT EXISTS anomaly_issue_report_ref_idx ON anomaly_issue (report_ref)");
        jdbc.getJdbcTemplate().execute(
                "CREATE INDEX IF NOT EXISTS anomaly_issue_report_status_idx ON anomaly_issue (report_status)");
        jdbc.getJdbcTemplate().execute(
                "CREATE INDEX IF NOT EXISTS anomaly_issue_policy_idx ON anomaly_issue (policy_excluded)");

        log.info("Issue store schema ready.");
    }

    @Override
    public List<Issue> selectEligible() {
        List<Issue> issues = jdbc.query(
                "SELECT * FROM " + TABLE + " WHERE report_ref IS NULL AND policy_excluded = FALSE" + ORDER,
                rowMapper);
        log.info("{} stored issue(s) without report and outside policy zones", issues.size());
        return issues;
    }

    @Override
    public List<Issue> selectUnclosed(Collection<String> unclosedStatuses) {
        if (unclosedStatuses == null || unclosedStatuses.isEmpty()) return List.of();
        List<Issue> issues = jdbc.query(
                "SELECT * FROM " + TABLE
                        + " WHERE report_ref IS NOT NULL AND report_status IN (:statuses)" + ORDER,
                Map.of("statuses", unclosedStatuses),
                rowMapper);
        log.info("{} stored issue(s) with an unclosed report status in {}", issues.size(), unclosedStatuses);
        return issues;
    }

    @Override
    public List<Issue> selectPolicyZoneUnresolved() {
        return jdbc.query(
                "SELECT * FROM " + TABLE + " WHERE policy_excluded IS NULL" + ORDER,
                rowMapper);
    }

    @Override
    public Optional<Issue> findByKey(String externalKey) {
        List<Issue> found = jdbc.query(
                "SELECT * FROM " + TABLE + " WHERE external_key = :key",
                Map.of("key", externalKey),
                rowMapper);
        return found.stream().findFirst();
    }

    @Override
    public void persist(Issue issue) {
        if (issue.getExternalKey() == null) {
            throw new IllegalArgumentException("Cannot persist an issue without external key");
        }
        if (issue.getIngestedAt() == null) {
            issue.setIngestedAt(LocalDateTime.now());
        }
        MapSqlParameterSource params = IssueRowMapper.toParameters(issue);

        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbc.update(UPDATE_SQL, params);
            if (updated == 0) {
                jdbc.update(INSERT_SQL, params);
                log.debug("Inserted issue {}", issue.getExternalKey());
            } else {
                log.debug("Updated issue {}", issue.getExternalKey());
            }
        });
    }
}
