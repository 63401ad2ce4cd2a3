package com.geointel.reporter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.model.AdministrativeUnit;
import com.geointel.reporter.model.FeedQuery;
import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.IssueDraft;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.model.ReferenceObject;
import com.geointel.reporter.model.Territory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssueMapperTest {

    private IssueMapper mapper;

    @BeforeEach
    void setUp() {
        ReporterProperties.ClassDefinition missingName = new ReporterProperties.ClassDefinition();
        missingName.setTitleFr("Nom manquant");
        missingName.setTitleEn("Missing name");

        ReporterProperties.ItemDefinition road = new ReporterProperties.ItemDefinition();
        road.setNameFr("route");
        road.setNameEn("road");
        road.setTheme("Route");
        road.setReferenceClass("troncon_de_route");
        road.getClasses().put(1, missingName);

        ReporterProperties properties = new ReporterProperties();
        properties.getItems().put(7170, road);
        mapper = new IssueMapper(properties);
    }

    @Test
    void mapsDraftAndLabelsFromCatalog() throws Exception {
        Issue issue = mapper.map(draft("48.1", "-1.6"), query());

        assertThat(issue.getExternalKey()).isEqualTo("k1");
        assertThat(issue.getFeedStatus()).isEqualTo(FeedStatus.FALSE_POSITIVE);
        assertThat(issue.getCountry()).isEqualTo("france");
        assertThat(issue.getLatitude()).isEqualTo(48.1);
        assertThat(issue.getLongitude()).isEqualTo(-1.6);
        assertThat(issue.getItemNameFr()).isEqualTo("route");
        assertThat(issue.getClassTitleFr()).isEqualTo("Nom manquant");
        assertThat(issue.getTheme()).isEqualTo("Route");
        assertThat(issue.getReferenceClass()).isEqualTo("troncon_de_route");
        assertThat(issue.getUsernames()).isEqualTo("alice,bob");
        assertThat(issue.getOsmElements()).isEqualTo("{\"ways\":[42]}");
        assertThat(issue.getFeedUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 2, 10, 21, 45));
        assertThat(issue.getPolicyZone()).isEqualTo(PolicyZone.UNKNOWN);
        assertThat(issue.getReportRef()).isNull();
    }

    @Test
    void unknownClassLeavesTitlesEmpty() throws Exception {
        IssueDraft draft = draft("48.1", "-1.6");
        draft.setClassId(99);

        Issue issue = mapper.map(draft, query());

        assertThat(issue.getClassId()).isEqualTo(99);
        assertThat(issue.getItemNameFr()).isEqualTo("route");
        assertThat(issue.getClassTitleFr()).isNull();
    }

    @Test
    void rejectsMalformedCoordinates() throws Exception {
        assertThatThrownBy(() -> mapper.map(draft("north", "-1.6"), query()))
                .isInstanceOf(DataContractViolationException.class)
                .hasMessageContaining("k1");
        assertThatThrownBy(() -> mapper.map(draft("48.1", null), query()))
                .isInstanceOf(DataContractViolationException.class);
    }

    @Test
    void rejectsDraftWithoutId() throws Exception {
        IssueDraft draft = draft("48.1", "-1.6");
        draft.setId(" ");

        assertThatThrownBy(() -> mapper.map(draft, query()))
                .isInstanceOf(DataContractViolationException.class);
    }

    @Test
    void appliesLookups() {
        Issue issue = Issue.builder().externalKey("k1").build();

        mapper.applyAdministrativeUnit(issue, new AdministrativeUnit("35238", "Rennes", "3599", "352",
                "Rennes", null, null, "35", "Ille-et-Vilaine", "53", "Bretagne"));
        mapper.applyTerritory(issue, new Territory("Métropole", 2154, 351000.0, 6789000.0));
        mapper.applyReferenceObject(issue,
                new ReferenceObject("TRONROUT0001", "rue de la Paix", "Route à 1 chaussée", "2", "4", null, "2023-01-01"));
        mapper.applyReferenceObject(issue, null);

        assertThat(issue.getDepartmentCode()).isEqualTo("35");
        assertThat(issue.getRegionName()).isEqualTo("Bretagne");
        assertThat(issue.getTerritorySrid()).isEqualTo(2154);
        assertThat(issue.getReferenceObjectId()).isEqualTo("TRONROUT0001");
        assertThat(issue.getAttribute1()).isEqualTo("rue de la Paix");
    }

    private static IssueDraft draft(String lat, String lon) throws Exception {
        IssueDraft draft = new IssueDraft();
        draft.setId("k1");
        draft.setItem(7170);
        draft.setClassId(1);
        draft.setLevel(2);
        draft.setSource(12345);
        draft.setLat(lat);
        draft.setLon(lon);
        draft.setUpdate("2024-05-02 10:21:45+00:00");
        draft.setUsernames(List.of("alice", "bob"));
        draft.setOsmIds(new ObjectMapper().readTree("{\"ways\":[42]}"));
        return draft;
    }

    private static FeedQuery query() {
        return FeedQuery.builder()
                .country("france")
                .itemId(7170)
                .classId(1)
                .status(FeedStatus.FALSE_POSITIVE)
                .build();
    }
}
