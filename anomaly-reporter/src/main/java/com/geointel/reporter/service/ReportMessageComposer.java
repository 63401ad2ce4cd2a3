package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.IssueInvariantException;
import com.geointel.reporter.model.Issue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the markdown text of a report from an enriched issue.
 */
@Component
@RequiredArgsConstructor
public class ReportMessageComposer {

    private static final String UNKNOWN_DATE = "inconnue";

    private final ReporterProperties properties;

    /**
     * @throws IssueInvariantException when the issue lacks the labels a report needs
     */
    public String compose(Issue issue) {
        require(issue, issue.getItemNameFr(), "French item name");
        require(issue, issue.getClassTitleFr(), "French class title");
        require(issue, issue.getTheme(), "reporting theme");
        ReporterProperties.Report report = properties.getReport();

        StringBuilder message = new StringBuilder()
                .append(report.getKeyword()).append('\n')
                .append("Alerte d'incohérence sur un objet de type ").append(issue.getItemNameFr()).append('\n')
                .append("Incohérence [ ").append(issue.getClassTitleFr()).append(" ] OSM/IGN.\n")
                .append("La cartographie IGN est (Plan IGN J+1) ").append(mapUrl(issue)).append('\n');

        String path = administrativePath(issue);
        if (!path.isEmpty()) {
            message.append(path).append('\n');
        }

        if (issue.getReferenceObjectId() != null) {
            message.append("Objet BDUni concerné: Cleabs: ").append(issue.getReferenceObjectId())
                    .append(" de date de dernière modification en BDUni ")
                    .append(issue.getReferenceModifiedAt() == null ? UNKNOWN_DATE : issue.getReferenceModifiedAt())
                    .append('\n');
            appendAttributes(message, issue);
        }
        return message.toString();
    }

    /** Description of the issue opening a cluster report, with the notice pointing at the sketch. */
    public String withClusterNotice(String description) {
        return description + "\n " + properties.getReport().getClusterNotice() + "\n ";
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String mapUrl(Issue issue) {
        return properties.getReport().getMapUrlTemplate()
                .replace("{lon}", String.valueOf(issue.getLongitude()))
                .replace("{lat}", String.valueOf(issue.getLatitude()));
    }

    private static String administrativePath(Issue issue) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, issue.getTerritoryName());
        addIfPresent(parts, issue.getRegionName());
        addIfPresent(parts, issue.getDepartmentName());
        addIfPresent(parts, issue.getCollectivityName());
        addIfPresent(parts, issue.getCommuneName());
        addIfPresent(parts, issue.getArrondissementName());
        return String.join(" / ", parts);
    }

    private void appendAttributes(StringBuilder message, Issue issue) {
        ReporterProperties.ItemDefinition item = properties.getItems().get(issue.getItemId());
        if (item == null) return;
        String[] values = {
                issue.getAttribute1(), issue.getAttribute2(), issue.getAttribute3(),
                issue.getAttribute4(), issue.getAttribute5()
        };
        for (int i = 0; i < values.length; i++) {
            String name = item.attributeName(i);
            if (name != null) {
                message.append(name).append(": ").append(values[i] == null ? "" : values[i]).append('\n');
            }
        }
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) parts.add(value);
    }

    private static void require(Issue issue, String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IssueInvariantException(issue.getExternalKey(), "missing " + label);
        }
    }
}
