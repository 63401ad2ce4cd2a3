package com.geointel.reporter.store;

import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.model.ReportLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the store against an in-memory H2 database in PostgreSQL mode.
 */
class JdbcIssueStoreTest {

    private JdbcIssueStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        store = new JdbcIssueStore(new NamedParameterJdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
        store.ensureSchema();
    }

    @Test
    void schemaCreationIsIdempotent() {
        store.ensureSchema();
        assertThat(store.selectEligible()).isEmpty();
    }

    @Test
    @DisplayName("signed report reference and tri-state policy zone survive a round trip")
    void roundTrip() {
        Issue linked = issue("A", PolicyZone.NOT_EXCLUDED);
        linked.setReportLink(ReportLink.linkedTo(77));
        linked.setClusterKey("7170_1_rue de la paix_0");
        store.persist(linked);
        store.persist(issue("B", PolicyZone.UNKNOWN));

        Issue a = store.findByKey("A").orElseThrow();
        assertThat(a.getReportRef()).isEqualTo(-77L);
        assertThat(a.getReportLink()).isEqualTo(new ReportLink.LinkedTo(77));
        assertThat(a.getPolicyZone()).isEqualTo(PolicyZone.NOT_EXCLUDED);
        assertThat(a.getFeedStatus()).isEqualTo(FeedStatus.FALSE_POSITIVE);
        assertThat(a.getClusterKey()).isEqualTo("7170_1_rue de la paix_0");
        assertThat(a.getLatitude()).isEqualTo(48.1);
        assertThat(a.getReportStatus()).isNull();

        Issue b = store.findByKey("B").orElseThrow();
        assertThat(b.getPolicyZone()).isEqualTo(PolicyZone.UNKNOWN);
        assertThat(b.getReportRef()).isNull();
        assertThat(store.findByKey("missing")).isEmpty();
    }

    @Test
    void selectEligibleKeepsUnreportedIssuesOutsidePolicyZones() {
        store.persist(issue("eligible", PolicyZone.NOT_EXCLUDED));
        store.persist(issue("excluded", PolicyZone.EXCLUDED));
        store.persist(issue("unresolved", PolicyZone.UNKNOWN));
        Issue reported = issue("reported", PolicyZone.NOT_EXCLUDED);
        reported.setReportLink(ReportLink.owner(5));
        reported.setReportStatus("submit");
        store.persist(reported);

        assertThat(store.selectEligible()).extracting(Issue::getExternalKey).containsExactly("eligible");
        assertThat(store.selectPolicyZoneUnresolved()).extracting(Issue::getExternalKey)
                .containsExactly("unresolved");
    }

    @Test
    void selectUnclosedFiltersOnStatusAllowList() {
        store.persist(reportedIssue("open", 1, "submit"));
        store.persist(reportedIssue("pending", 2, "pending1"));
        store.persist(reportedIssue("closed", 3, "valid"));
        store.persist(reportedIssue("rejected", 4, "reject"));

        List<Issue> unclosed = store.selectUnclosed(List.of("submit", "pending1"));

        assertThat(unclosed).extracting(Issue::getExternalKey).containsExactlyInAnyOrder("open", "pending");
        assertThat(store.selectUnclosed(List.of())).isEmpty();
    }

    @Test
    @DisplayName("linked cluster members are neither eligible nor polled for status")
    void linkedMemberIsExcludedFromBothSelections() {
        store.persist(reportedIssue("owner", 77, "submit"));
        Issue member = issue("member", PolicyZone.NOT_EXCLUDED);
        member.setReportLink(ReportLink.linkedTo(77));
        store.persist(member);

        assertThat(store.selectEligible()).isEmpty();
        assertThat(store.selectUnclosed(List.of("test", "submit", "repost")))
                .extracting(Issue::getExternalKey)
                .containsExactly("owner");
        assertThat(store.findByKey("member").orElseThrow().getReportRef()).isEqualTo(-77L);
    }

    @Test
    @DisplayName("persisting an existing key updates it and keeps the first ingestion time")
    void upsertKeepsIngestionTime() {
        Issue first = issue("A", PolicyZone.UNKNOWN);
        first.setIngestedAt(LocalDateTime.of(2024, 1, 1, 8, 0));
        store.persist(first);

        Issue second = issue("A", PolicyZone.EXCLUDED);
        second.setIngestedAt(LocalDateTime.of(2024, 6, 1, 8, 0));
        second.setReportStatus("test");
        store.persist(second);

        Issue stored = store.findByKey("A").orElseThrow();
        assertThat(stored.getPolicyZone()).isEqualTo(PolicyZone.EXCLUDED);
        assertThat(stored.getReportStatus()).isEqualTo("test");
        assertThat(stored.getIngestedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    void persistStampsIngestionTimeWhenMissing() {
        Issue issue = issue("A", PolicyZone.UNKNOWN);

        store.persist(issue);

        assertThat(issue.getIngestedAt()).isNotNull();
        assertThat(store.findByKey("A").orElseThrow().getIngestedAt()).isNotNull();
    }

    @Test
    void persistRejectsIssueWithoutKey() {
        assertThatThrownBy(() -> store.persist(issue(null, PolicyZone.UNKNOWN)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Issue issue(String key, PolicyZone zone) {
        return Issue.builder()
                .externalKey(key)
                .feedStatus(FeedStatus.FALSE_POSITIVE)
                .itemId(7170)
                .classId(1)
                .latitude(48.1)
                .longitude(-1.6)
                .policyZone(zone)
                .build();
    }

    private static Issue reportedIssue(String key, long reportId, String status) {
        Issue issue = issue(key, PolicyZone.NOT_EXCLUDED);
        issue.setReportLink(ReportLink.owner(reportId));
        issue.setReportStatus(status);
        return issue;
    }
}
