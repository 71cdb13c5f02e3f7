package com.flagship.gate_ledger.observability;

import com.flagship.gate_ledger.gate.CheckoutSource;
import com.flagship.gate_ledger.gate.ScanDirection;
import com.flagship.gate_ledger.ledger.UserType;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for gate operations.
 *
 * Metrics exposed:
 * - gate.scans{direction, user_type}: completed scans
 * - gate.scans.failed: scans rolled back
 * - gate.scan.latency: scan duration
 * - gate.checkouts{source}: entries closed by operators
 * - gate.resolution.rows{trigger}: unknown rows given an identity
 * - gate.resolution.sweep.regnos: regNos resolved by sweeps
 */
@Component
public class GateMetrics {

    private final MeterRegistry registry;

    public GateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScan(ScanDirection direction, UserType userType) {
        registry.counter("gate.scans",
                "direction", direction.name(),
                "user_type", userType.name()
        ).increment();
    }

    public void recordScanFailed(String reason) {
        registry.counter("gate.scans.failed", "reason", sanitizeTag(reason)).increment();
    }

    public void recordScanLatency(long durationMs) {
        registry.timer("gate.scan.latency").record(Duration.ofMillis(durationMs));
    }

    public void recordCheckouts(CheckoutSource source, int count) {
        registry.counter("gate.checkouts", "source", source.name()).increment(count);
    }

    public void recordResolvedRows(String trigger, int rows) {
        registry.counter("gate.resolution.rows", "trigger", sanitizeTag(trigger)).increment(rows);
    }

    public void recordSweep(int resolvedRegNos) {
        registry.counter("gate.resolution.sweep.regnos").increment(resolvedRegNos);
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
