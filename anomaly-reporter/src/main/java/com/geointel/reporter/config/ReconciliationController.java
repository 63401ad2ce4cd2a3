package com.geointel.reporter.config;

import com.geointel.reporter.model.FeedStatus;
import com.geointel.reporter.model.ReportMode;
import com.geointel.reporter.model.RunRequest;
import com.geointel.reporter.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    // ── Triggers ─────────────────────────────────────────────────────────────

    /**
     * Start a reconciliation in the background. Unset parameters fall back to reporter.run defaults.
     *
     * POST /reconcile/trigger?mode=test&department=35&startDate=2024-01-01&endDate=2024-02-01
     */
    @PostMapping("/reconcile/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) String feedStatus,
            @RequestParam(defaultValue = "false") boolean statusesOnly,
            @RequestParam(required = false) List<String> country,
            @RequestParam(required = false) List<String> source,
            @RequestParam(required = false) List<Integer> item,
            @RequestParam(required = false) List<String> department,
            @RequestParam(required = false) List<String> region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        RunRequest request;
        try {
            RunRequest.RunRequestBuilder builder = reconciliationService.defaultRequest().toBuilder()
                    .statusesOnly(statusesOnly)
                    .departments(department)
                    .regions(region);
            if (mode != null) builder.mode(ReportMode.fromCode(mode));
            if (feedStatus != null) builder.feedStatus(FeedStatus.fromCode(feedStatus));
            if (country != null) builder.clearCountries().countries(country);
            if (source != null) builder.clearSources().sources(source);
            if (item != null) builder.clearItems().items(item);
            if (startDate != null) builder.startDate(startDate);
            if (endDate != null) builder.endDate(endDate);
            request = builder.build();
            reconciliationService.validate(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (reconciliationService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a run is already in progress"));
        }
        new Thread(() -> runQuietly(request), "manual-reconcile").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "mode", request.getMode().getCode()));
    }

    @PostMapping("/reconcile/statuses")
    public ResponseEntity<Map<String, String>> refreshStatuses() {
        if (reconciliationService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a run is already in progress"));
        }
        new Thread(this::refreshQuietly, "manual-status-refresh").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "statuses"));
    }

    @GetMapping("/reconcile/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "geointel-anomaly-reporter");
        body.put("version", "1.0.0");
        body.put("running", reconciliationService.isRunning());
        body.put("lastRun", reconciliationService.getLastRun().orElse(null));
        return ResponseEntity.ok(body);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void runQuietly(RunRequest request) {
        try {
            reconciliationService.run(request);
        } catch (Exception e) {
            log.warn("Manual reconciliation ended in failure: {}", e.getMessage(), e);
        }
    }

    private void refreshQuietly() {
        try {
            reconciliationService.refreshStatuses();
        } catch (Exception e) {
            log.warn("Manual status refresh ended in failure: {}", e.getMessage(), e);
        }
    }
}
