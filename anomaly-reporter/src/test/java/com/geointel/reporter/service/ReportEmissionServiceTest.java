package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.DataContractViolationException;
import com.geointel.reporter.exception.IssueInvariantException;
import com.geointel.reporter.exception.ReportEmissionException;
import com.geointel.reporter.exception.ReporterException;
import com.geointel.reporter.exception.ReportingServiceException;
import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.model.ReportMode;
import com.geointel.reporter.model.ReportRequest;
import com.geointel.reporter.store.IssueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportEmissionServiceTest {

    @Mock
    private ReportingClient reportingClient;

    @Mock
    private IssueStore store;

    @Mock
    private CallPacer pacer;

    private ReportEmissionService service;

    @BeforeEach
    void setUp() {
        service = new ReportEmissionService(reportingClient, store,
                new ReportMessageComposer(new ReporterProperties()), pacer);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("a cluster of three files one report, owned by its first member")
    void clusterFilesOneReport() {
        Issue a = issue("A", "K1");
        Issue b = issue("B", "K1");
        Issue c = issue("C", "K1");
        when(reportingClient.createReport(any())).thenReturn(101L);

        EmissionResult result = service.emit(List.of(a, b, c), ReportMode.SUBMIT);

        assertThat(a.getReportRef()).isEqualTo(101L);
        assertThat(b.getReportRef()).isEqualTo(-101L);
        assertThat(c.getReportRef()).isEqualTo(-101L);
        assertThat(a.getReportStatus()).isEqualTo("submit");
        assertThat(b.getReportStatus()).isNull();
        assertThat(c.getReportStatus()).isNull();
        assertThat(result).isEqualTo(new EmissionResult(1, 2, 3));
        verify(reportingClient, times(1)).createReport(any());
        verify(store, times(3)).persist(any());
    }

    @Test
    void standaloneIssueOwnsItsReport() {
        Issue d = issue("D", null);
        when(reportingClient.createReport(any())).thenReturn(202L);

        service.emit(List.of(d), ReportMode.DRY_RUN);

        assertThat(d.getReportRef()).isEqualTo(202L);
        assertThat(d.getReportStatus()).isEqualTo("test");
        ArgumentCaptor<ReportRequest> captor = ArgumentCaptor.forClass(ReportRequest.class);
        verify(reportingClient).createReport(captor.capture());
        assertThat(captor.getValue().sketch()).isNull();
        assertThat(captor.getValue().message()).isEqualTo(d.getDescription());
        assertThat(captor.getValue().mode()).isEqualTo(ReportMode.DRY_RUN);
        assertThat(captor.getValue().theme()).isEqualTo("Route");
    }

    @Test
    @DisplayName("a standalone issue between clusters resets the cluster run")
    void mixedSequence() {
        List<Issue> issues = List.of(
                issue("1", "K1"), issue("2", "K1"), issue("3", null), issue("4", "K2"), issue("5", "K2"));
        when(reportingClient.createReport(any())).thenReturn(1L, 2L, 3L);

        EmissionResult result = service.emit(issues, ReportMode.SUBMIT);

        assertThat(issues).extracting(Issue::getReportRef).containsExactly(1L, -1L, 2L, 3L, -3L);
        assertThat(result.reportsCreated()).isEqualTo(3);
        assertThat(result.issuesLinked()).isEqualTo(2);
        verify(reportingClient, times(3)).createReport(any());
        verify(pacer, times(3)).pause();
    }

    @Test
    @DisplayName("the cluster owner's report carries the notice and the sketch")
    void clusterOwnerMessage() {
        Issue a = issue("A", "K1");
        a.setSketch("{\"name\":\"Emprise du cluster\"}");
        when(reportingClient.createReport(any())).thenReturn(9L);

        service.emit(List.of(a), ReportMode.SUBMIT);

        ArgumentCaptor<ReportRequest> captor = ArgumentCaptor.forClass(ReportRequest.class);
        verify(reportingClient).createReport(captor.capture());
        assertThat(captor.getValue().sketch()).isEqualTo(a.getSketch());
        assertThat(captor.getValue().message())
                .startsWith(a.getDescription())
                .contains("ce signalement englobe une zone");
    }

    @Test
    @DisplayName("every issue of a run shares one refresh timestamp")
    void sharedRefreshTimestamp() {
        Issue a = issue("A", "K1");
        Issue b = issue("B", "K1");
        Issue c = issue("C", null);
        when(reportingClient.createReport(any())).thenReturn(1L, 2L);

        service.emit(List.of(a, b, c), ReportMode.RESUBMIT_UNREPORTED);

        assertThat(a.getStatusRefreshedAt()).isNotNull()
                .isEqualTo(b.getStatusRefreshedAt())
                .isEqualTo(c.getStatusRefreshedAt());
        assertThat(c.getReportStatus()).isEqualTo("repost");
    }

    @Test
    @DisplayName("a failure keeps earlier issues persisted and names the failing issue")
    void failureKeepsEarlierIssues() {
        Issue a = issue("A", null);
        Issue b = issue("B", null);
        when(reportingClient.createReport(any()))
                .thenReturn(1L)
                .thenThrow(new ReportingServiceException(500, "boom"));

        assertThatThrownBy(() -> service.emit(List.of(a, b), ReportMode.SUBMIT))
                .isInstanceOfSatisfying(ReportEmissionException.class, e -> {
                    assertThat(e.getIssueKey()).isEqualTo("B");
                    assertThat(e.getReportsCreatedBeforeFailure()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(ReportingServiceException.class);
                });

        assertThat(a.getReportRef()).isEqualTo(1L);
        assertThat(b.getReportRef()).isNull();
        verify(store).persist(a);
        verify(store, never()).persist(b);
    }

    @Test
    @DisplayName("a cluster interrupted after its owner resumes on the next run as a new cluster")
    void clusterFailureThenRerun() {
        AtomicBoolean storeDown = new AtomicBoolean(true);
        doAnswer(invocation -> {
            Issue persisted = invocation.getArgument(0);
            if (storeDown.get() && "B".equals(persisted.getExternalKey())) {
                throw new DataAccessResourceFailureException("store unavailable");
            }
            return null;
        }).when(store).persist(any());
        when(reportingClient.createReport(any())).thenReturn(101L, 202L);

        Issue a = issue("A", "K1");
        assertThatThrownBy(() -> service.emit(List.of(a, issue("B", "K1"), issue("C", "K1")), ReportMode.SUBMIT))
                .isInstanceOfSatisfying(ReportEmissionException.class, e -> {
                    assertThat(e.getIssueKey()).isEqualTo("B");
                    assertThat(e.getReportsCreatedBeforeFailure()).isEqualTo(1);
                });
        assertThat(a.getReportRef()).isEqualTo(101L);
        assertThat(a.getReportStatus()).isEqualTo("submit");

        // B and C are still unreported in the store and come back with the same cluster key
        storeDown.set(false);
        Issue b = issue("B", "K1");
        Issue c = issue("C", "K1");

        EmissionResult result = service.emit(List.of(b, c), ReportMode.SUBMIT);

        assertThat(b.getReportRef()).isEqualTo(202L);
        assertThat(b.getReportStatus()).isEqualTo("submit");
        assertThat(c.getReportRef()).isEqualTo(-202L);
        assertThat(c.getReportStatus()).isNull();
        assertThat(result).isEqualTo(new EmissionResult(1, 1, 2));
        verify(reportingClient, times(2)).createReport(any());
    }

    @Test
    @DisplayName("an interrupted thread files no report")
    void interruptedBeforeFirstIssue() {
        ReporterProperties properties = new ReporterProperties();
        properties.getPacing().setDelayMs(500);
        ReportEmissionService paced = new ReportEmissionService(reportingClient, store,
                new ReportMessageComposer(properties), new CallPacer(properties));
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> paced.emit(
                List.of(issue("A", null), issue("B", null), issue("C", null)), ReportMode.SUBMIT))
                .isInstanceOfSatisfying(ReportEmissionException.class, e -> {
                    assertThat(e.getIssueKey()).isEqualTo("A");
                    assertThat(e.getReportsCreatedBeforeFailure()).isZero();
                    assertThat(e.getCause()).isInstanceOf(ReporterException.class);
                });
        verifyNoInteractions(reportingClient, store);
    }

    @Test
    @DisplayName("an interrupt during a remote call stops the run once that issue is persisted")
    void interruptedDuringRemoteCall() {
        ReporterProperties properties = new ReporterProperties();
        properties.getPacing().setDelayMs(500);
        ReportEmissionService paced = new ReportEmissionService(reportingClient, store,
                new ReportMessageComposer(properties), new CallPacer(properties));
        when(reportingClient.createReport(any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return 1L;
        });
        Issue a = issue("A", null);

        assertThatThrownBy(() -> paced.emit(List.of(a, issue("B", null), issue("C", null)), ReportMode.SUBMIT))
                .isInstanceOfSatisfying(ReportEmissionException.class, e -> {
                    assertThat(e.getIssueKey()).isEqualTo("A");
                    assertThat(e.getReportsCreatedBeforeFailure()).isEqualTo(1);
                });

        assertThat(a.getReportRef()).isEqualTo(1L);
        verify(store).persist(a);
        verify(reportingClient, times(1)).createReport(any());
    }

    @Test
    void rejectsNonPositiveReportId() {
        Issue a = issue("A", null);
        when(reportingClient.createReport(any())).thenReturn(0L);

        assertThatThrownBy(() -> service.emit(List.of(a), ReportMode.SUBMIT))
                .isInstanceOf(ReportEmissionException.class)
                .hasCauseInstanceOf(DataContractViolationException.class);
        assertThat(a.getReportRef()).isNull();
        verify(store, never()).persist(any());
    }

    @Test
    @DisplayName("missing labels abort before any remote call")
    void missingLabelsAbortBeforeRemoteCall() {
        Issue a = issue("A", null);
        a.setItemNameFr(null);

        assertThatThrownBy(() -> service.emit(List.of(a), ReportMode.SUBMIT))
                .isInstanceOf(ReportEmissionException.class)
                .hasCauseInstanceOf(IssueInvariantException.class);
        verifyNoInteractions(reportingClient, store);
    }

    @Test
    void skipModeIsRejected() {
        assertThatThrownBy(() -> service.emit(List.of(issue("A", null)), ReportMode.SKIP))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(reportingClient, store);
    }

    @Test
    void emptyBatchDoesNothing() {
        assertThat(service.emit(List.of(), ReportMode.SUBMIT)).isEqualTo(EmissionResult.empty());
        verifyNoInteractions(reportingClient, store, pacer);
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private static Issue issue(String key, String clusterKey) {
        return Issue.builder()
                .externalKey(key)
                .latitude(48.1)
                .longitude(-1.6)
                .itemId(7170)
                .classId(1)
                .itemNameFr("route")
                .classTitleFr("OSM ne constate pas de route à cet endroit")
                .theme("Route")
                .policyZone(PolicyZone.NOT_EXCLUDED)
                .clusterKey(clusterKey)
                .build();
    }
}
