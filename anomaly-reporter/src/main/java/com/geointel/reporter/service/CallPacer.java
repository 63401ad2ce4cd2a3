package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties;
import com.geointel.reporter.exception.ReporterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fixed pause taken after each call to a third-party service.
 * None of them documents a rate limit, the delay keeps our load polite.
 *
 * An interrupted thread gets no further remote call: the pause throws instead of returning early.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CallPacer {

    private final ReporterProperties properties;

    /**
     * @throws ReporterException when the thread is interrupted, with the interrupt flag restored
     */
    public void pause() {
        sleepMs(properties.getPacing().getDelayMs());
    }

    /**
     * Called at issue boundaries so an interrupted loop stops before its next remote call.
     *
     * @throws ReporterException when the thread is interrupted
     */
    public void checkNotInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ReporterException("Interrupted between remote calls");
        }
    }

    private void sleepMs(long ms) {
        checkNotInterrupted();
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            log.warn("Interrupted while pacing remote calls");
            Thread.currentThread().interrupt();
            throw new ReporterException("Interrupted between remote calls", ie);
        }
    }
}
