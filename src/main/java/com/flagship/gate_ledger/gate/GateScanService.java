package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.gate.event.EntryCheckedInEvent;
import com.flagship.gate_ledger.gate.event.EntryCheckedOutEvent;
import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.identity.IdentityService;
import com.flagship.gate_ledger.ledger.LedgerEntry;
import com.flagship.gate_ledger.ledger.LedgerEntryPersistenceService;
import com.flagship.gate_ledger.observability.CorrelationContext;
import com.flagship.gate_ledger.observability.GateMetrics;
import com.flagship.gate_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Turns a gate scan into a check-in or a check-out.
 *
 * Per regNo this is a two-state machine, OUT and IN. The state is not
 * stored: a regNo is IN exactly when it has an open ledger entry.
 * - OUT + scan: a new open entry is created (IN)
 * - IN + scan: the open entry is closed (OUT)
 *
 * A regNo missing from the identity store is still logged, as UNKNOWN, and
 * is resolved later by the resolution service. Identity fields are never
 * refreshed on check-out.
 *
 * Read-open-entry plus create-or-close runs in one transaction under a
 * per-regNo advisory lock, so concurrent scans of one regNo are linearized
 * and scans of different regNos do not wait on each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GateScanService {

    static final String AGGREGATE_TYPE = "LedgerEntry";

    private final IdentityService identityService;
    private final LedgerEntryPersistenceService ledgerStore;
    private final OutboxService outboxService;
    private final GateMetrics gateMetrics;
    private final Clock clock;

    /**
     * Scans a regNo at the current time. The time is read once the regNo
     * lock is held, so it never precedes the transition it follows.
     */
    @Transactional
    public ScanResult scan(String regNo) {
        return execute(regNo, null);
    }

    /**
     * Scans a regNo at the given time.
     *
     * @param regNo Registration number read at the gate; surrounding whitespace is ignored
     * @param at Scan time
     * @return the created or closed entry with the transition that occurred
     * @throws IllegalArgumentException if regNo is blank, or if at precedes the
     *         check-in it would close
     */
    @Transactional
    public ScanResult scan(String regNo, Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("Scan time is required");
        }
        return execute(regNo, at);
    }

    private ScanResult execute(String regNo, Instant requestedAt) {
        if (regNo == null || regNo.isBlank()) {
            throw new IllegalArgumentException("Registration number is required");
        }
        String key = regNo.trim();
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.REG_NO_MDC_KEY, key);

        try {
            ledgerStore.lockRegNo(key);
            Instant at = requestedAt != null ? requestedAt : now();

            Optional<Identity> identity = identityService.lookup(key);
            Optional<LedgerEntry> openEntry = ledgerStore.findOpenEntry(key);

            ScanResult result;
            if (openEntry.isPresent()) {
                LedgerEntry closed = ledgerStore.close(openEntry.get().getId(), at);
                outboxService.saveEvent(AGGREGATE_TYPE, key, EntryCheckedOutEvent.EVENT_TYPE,
                        EntryCheckedOutEvent.fromEntry(closed, CheckoutSource.SCAN));
                result = ScanResult.checkedOut(closed);
            } else {
                LedgerEntry created = ledgerStore.create(LedgerEntry.checkIn(key, identity.orElse(null), at));
                outboxService.saveEvent(AGGREGATE_TYPE, key, EntryCheckedInEvent.EVENT_TYPE,
                        EntryCheckedInEvent.fromEntry(created));
                result = ScanResult.checkedIn(created);
            }

            long duration = System.currentTimeMillis() - startTime;
            gateMetrics.recordScan(result.getDirection(), result.getEntry().getUserType());
            gateMetrics.recordScanLatency(duration);

            if (result.getEntry().isUnknown()) {
                log.info("Unknown regNo marked {}: entryId={}, duration={}ms",
                        result.getDirection(), result.getEntry().getId(), duration);
            } else {
                log.info("{} {} marked {}: entryId={}, duration={}ms",
                        result.getEntry().getUserType(), result.getEntry().getName(),
                        result.getDirection(), result.getEntry().getId(), duration);
            }
            return result;

        } catch (RuntimeException e) {
            gateMetrics.recordScanFailed(e.getClass().getSimpleName());
            log.error("Scan failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.REG_NO_MDC_KEY);
        }
    }

    private Instant now() {
        // Postgres keeps microseconds; truncating keeps returned and stored times equal
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
