package com.geointel.reporter.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.model.ClusterCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostgisReferenceServiceTest {

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void acceptsSchemaQualifiedTableNames() {
        assertThat(PostgisReferenceService.identifier("administratif.commune")).isEqualTo("administratif.commune");
        assertThat(PostgisReferenceService.identifier("troncon_de_route")).isEqualTo("troncon_de_route");
    }

    @Test
    void rejectsIdentifiersThatWouldInjectSql() {
        assertThatThrownBy(() -> PostgisReferenceService.identifier("commune; DROP TABLE anomaly_issue"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PostgisReferenceService.identifier("a.b.c"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PostgisReferenceService.identifier(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("missing and empty partition attributes are clustered together under one key")
    @SuppressWarnings("unchecked")
    void missingAndEmptyAttributeSharePartition() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        PostgisReferenceService service =
                new PostgisReferenceService(jdbc, new ReporterProperties(), objectMapper);
        when(jdbc.query(any(String.class), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        service.clusterize(List.of(
                new ClusterCandidate("A", 48.1, -1.6, 7170, 1, null),
                new ClusterCandidate("B", 48.1, -1.6, 7170, 1, ""),
                new ClusterCandidate("C", 48.1, -1.6, 7170, 1, "rue de la Paix")));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(sql.capture(), params.capture(), any(RowMapper.class));

        JsonNode rows = objectMapper.readTree((String) params.getValue().getValue("candidates"));
        assertThat(rows.get(0).get("attribute_1").asText()).isEqualTo(rows.get(1).get("attribute_1").asText());
        assertThat(rows.get(0).get("attribute_1").isNull()).isFalse();
        assertThat(rows.get(2).get("attribute_1").asText()).isEqualTo("rue de la Paix");

        // the partition and the key are computed from the same normalised value
        assertThat(sql.getValue())
                .contains("COALESCE(c.attribute_1, '') AS attribute_1")
                .contains("PARTITION BY item_id, class_id, attribute_1")
                .contains("class_id || '_' || attribute_1 || '_' || raw_cluster");
    }
}
