package com.flagship.gate_ledger.resolution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the resolution sweep periodically.
 *
 * Off by default; operators usually trigger the sweep through the API.
 * A failed run is logged and retried on the next tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "resolution.sweep.enabled", havingValue = "true")
public class ResolutionSweepScheduler {

    private final ResolutionService resolutionService;

    @Scheduled(fixedDelayString = "${resolution.sweep.interval-ms:300000}",
               initialDelayString = "${resolution.sweep.initial-delay-ms:60000}")
    public void sweep() {
        try {
            int resolved = resolutionService.sweepUnresolved();
            if (resolved > 0) {
                log.info("Scheduled sweep resolved {} regNos", resolved);
            }
        } catch (RuntimeException e) {
            log.error("Scheduled resolution sweep failed: {}", e.getMessage(), e);
        }
    }
}
