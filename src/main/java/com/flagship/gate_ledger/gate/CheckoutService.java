package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.gate.event.EntryCheckedOutEvent;
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
import java.util.List;
import java.util.UUID;

/**
 * Operator override of the check-out side of the scan state machine.
 *
 * Closes entries without a scan, e.g. for someone who left without scanning
 * or at end of day. Identity fields are not re-checked against the
 * identity store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final LedgerEntryPersistenceService ledgerStore;
    private final OutboxService outboxService;
    private final GateMetrics gateMetrics;
    private final Clock clock;

    /**
     * Closes one entry now.
     *
     * @throws com.flagship.gate_ledger.exception.EntryNotFoundException if the id is unknown
     * @throws IllegalStateException if the entry is already checked out
     */
    @Transactional
    public LedgerEntry closeEntry(UUID entryId) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            LedgerEntry closed = ledgerStore.close(entryId, now());
            outboxService.saveEvent(GateScanService.AGGREGATE_TYPE, closed.getRegNo(),
                    EntryCheckedOutEvent.EVENT_TYPE, EntryCheckedOutEvent.fromEntry(closed, CheckoutSource.MANUAL));
            gateMetrics.recordCheckouts(CheckoutSource.MANUAL, 1);

            log.info("Manually checked out entry for {}", closed.getRegNo());
            return closed;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Closes every open entry now. Closed entries are left as they are, so a
     * second call in a row closes nothing.
     *
     * @return number of entries closed
     */
    @Transactional
    public int closeAllOpen() {
        List<LedgerEntry> closed = ledgerStore.closeAllOpen(now());

        for (LedgerEntry entry : closed) {
            outboxService.saveEvent(GateScanService.AGGREGATE_TYPE, entry.getRegNo(),
                    EntryCheckedOutEvent.EVENT_TYPE, EntryCheckedOutEvent.fromEntry(entry, CheckoutSource.BULK));
        }
        gateMetrics.recordCheckouts(CheckoutSource.BULK, closed.size());

        log.info("Bulk checkout closed {} open entries", closed.size());
        return closed.size();
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
