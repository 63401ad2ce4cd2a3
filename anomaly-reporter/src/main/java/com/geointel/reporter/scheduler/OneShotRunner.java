package com.geointel.reporter.scheduler;

import com.geointel.reporter.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch mode: one reconciliation with default parameters, then the process exits
 * with 0 on success and 1 on failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reporter.scheduling", name = "one-shot", havingValue = "true")
public class OneShotRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ReconciliationService reconciliationService;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        log.info("One-shot mode, running a single reconciliation");
        try {
            reconciliationService.run(reconciliationService.defaultRequest());
            exitCode = 0;
        } catch (Exception e) {
            log.error("One-shot reconciliation failed, exiting with code 1: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
