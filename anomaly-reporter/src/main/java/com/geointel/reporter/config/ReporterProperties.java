package com.geointel.reporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "reporter")
@Data
public class ReporterProperties {

    private Feed feed = new Feed();
    private Reporting reporting = new Reporting();
    private Reference reference = new Reference();
    private Http http = new Http();
    private Pacing pacing = new Pacing();
    private Scheduling scheduling = new Scheduling();
    private Report report = new Report();
    private Run run = new Run();

    /** Item catalog keyed by feed item id. Items absent from it are never requested. */
    private Map<Integer, ItemDefinition> items = new LinkedHashMap<>();

    @Data
    public static class Feed {
        private String baseUrl = "https://osmose.openstreetmap.fr/api/0.3";
        private int limit = 10000;
        private boolean full = true;
    }

    @Data
    public static class Reporting {
        private String endpoint = "https://espacecollaboratif.ign.fr/gcms/api/reports";
        private String login;
        private String password;
        private int community;
        /** Remote statuses still worth polling. */
        private List<String> unclosedStatuses = new ArrayList<>(List.of(
                "test", "submit", "repost", "pending", "pending0", "pending1", "pending2"));
    }

    @Data
    public static class Reference {
        /** Clustering distance, metres. */
        private double clusterDistance = 1000;
        private int clusterMinPoints = 2;
        /** Projected SRID the clustering distance is measured in. */
        private int metricSrid = 2154;
        private String communeTable = "administratif.commune";
        private String departmentTable = "administratif.departement";
        private String regionTable = "administratif.region";
        private String arrondissementTable = "administratif.arrondissement";
        private String collectivityTable = "administratif.collectivite_territoriale";
        private String territoryTable = "administratif.territoire";
        private String collectorTable = "collecte.zone_de_collecte";
        private String policyZoneTable = "restriction.zicad";
        /** Search radius for the counterpart reference object, metres. */
        private double objectSearchRadius = 50;
        /** Department codes accepted by filters although absent from the department table. */
        private List<String> extraDepartmentCodes = new ArrayList<>(List.of("977", "978"));
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private String userAgent = "geointel/anomaly-reporter/1.0";
    }

    @Data
    public static class Pacing {
        /** Pause after each remote call, out of fairness to third-party services. */
        private long delayMs = 1000;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * MON";
        private String statusRefreshCron = "0 0 6 * * *";
        private boolean runOnStartup = false;
        /** Run once at startup and exit with the run outcome as exit code. */
        private boolean oneShot = false;
    }

    @Data
    public static class Report {
        /** Header line of every report message. */
        private String keyword = "ROBOT_ANOMALY_REPORTER";
        private String clusterNotice =
                "**Attention : ce signalement englobe une zone. Vous pouvez trouver cette zone sur la géométrie affichée ci-contre.**";
        private String sketchLabel = "Emprise du cluster";
        private String sketchZoom = "17";
        /** Map link template, {lon} and {lat} are substituted. */
        private String mapUrlTemplate =
                "https://www.geoportail.gouv.fr/carte?c={lon},{lat}&z=17&l0=GEOGRAPHICALGRIDSYSTEMS.MAPS.BDUNI.J1::GEOPORTAIL:OGC:WMTS(1)&permalink=yes";
    }

    /** Defaults of scheduled runs. */
    @Data
    public static class Run {
        private String mode = "skip";
        private List<String> countries = new ArrayList<>(List.of("france"));
        private List<String> sources = new ArrayList<>(List.of("*"));
        private List<Integer> items = new ArrayList<>(List.of(7170));
        private int lookbackDays = 31;
    }

    @Data
    public static class ItemDefinition {
        private String nameEn;
        private String nameFr;
        /** Reporting-service theme reports of this item are filed under. */
        private String theme;
        /** Reference table holding the counterpart objects. */
        private String referenceClass;
        private String geometryColumn = "geometrie";
        /** Up to five attribute columns read from the reference object; the first partitions clusters. */
        private List<String> attributes = new ArrayList<>();
        private Map<Integer, ClassDefinition> classes = new LinkedHashMap<>();

        public String attributeName(int index) {
            return index < attributes.size() ? attributes.get(index) : null;
        }
    }

    @Data
    public static class ClassDefinition {
        private String titleFr;
        private String titleEn;
    }
}
