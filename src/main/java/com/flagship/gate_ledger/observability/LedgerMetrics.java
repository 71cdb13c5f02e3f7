package com.flagship.gate_ledger.observability;

import com.flagship.gate_ledger.ledger.LedgerEntryRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for people currently inside and for entries still waiting on an identity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerMetrics {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong openEntries = new AtomicLong(0);
    private final AtomicLong unresolvedEntries = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("gate.entries.open", openEntries, AtomicLong::get)
                .description("Ledger entries checked in and not yet checked out")
                .register(meterRegistry);

        Gauge.builder("gate.entries.unresolved", unresolvedEntries, AtomicLong::get)
                .description("Ledger entries logged against an unknown regNo")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            openEntries.set(ledgerEntryRepository.countByCheckOutTimeIsNull());
            unresolvedEntries.set(ledgerEntryRepository.countByNameIsNull());
        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }

    public long getOpenEntries() {
        return openEntries.get();
    }

    public long getUnresolvedEntries() {
        return unresolvedEntries.get();
    }
}
