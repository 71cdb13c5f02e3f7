package com.flagship.gate_ledger.resolution;

import com.flagship.gate_ledger.gate.event.UnknownEntriesResolvedEvent;
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
import java.util.List;
import java.util.Optional;

/**
 * Gives UNKNOWN ledger entries their identity once the regNo is registered.
 *
 * Two triggers:
 * - registration: an operator registers the identity of an unknown regNo
 * - sweep: every distinct unresolved regNo is looked up again
 *
 * Only rows whose identity is still missing are touched, so both triggers
 * are idempotent and never overwrite an entry that already has an identity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolutionService {

    private static final String AGGREGATE_TYPE = "LedgerEntry";

    private final IdentityService identityService;
    private final LedgerEntryPersistenceService ledgerStore;
    private final OutboxService outboxService;
    private final GateMetrics gateMetrics;
    private final Clock clock;

    /**
     * Registers an identity and resolves its unknown entries in one transaction.
     *
     * The regNo scan lock is held while resolving, so an unknown entry
     * created by a concurrent scan is either resolved here or sees the new
     * identity itself.
     *
     * @param identity validated identity; stored under its variant
     * @return number of ledger entries resolved
     * @throws com.flagship.gate_ledger.exception.IdentityConflictException if the
     *         regNo is registered under the other variant
     */
    @Transactional
    public int registerAndResolve(Identity identity) {
        MDC.put(CorrelationContext.REG_NO_MDC_KEY, identity.getRegNo());
        try {
            Identity stored = identityService.upsert(identity);
            ledgerStore.lockRegNo(stored.getRegNo());

            int rows = resolve(stored, UnknownEntriesResolvedEvent.TRIGGER_REGISTRATION);

            log.info("Registered {} identity and resolved {} unknown entries", stored.getType(), rows);
            return rows;
        } finally {
            MDC.remove(CorrelationContext.REG_NO_MDC_KEY);
        }
    }

    /**
     * Re-checks every unresolved regNo against the identity store.
     *
     * A regNo still missing from the store is left untouched. Running the
     * sweep again without new registrations changes nothing.
     *
     * @return number of regNos that had at least one entry resolved
     * @throws com.flagship.gate_ledger.exception.StoreUnavailableException if the
     *         identity store cannot be reached
     */
    @Transactional
    public int sweepUnresolved() {
        List<String> pending = ledgerStore.findUnresolvedRegNos();
        if (pending.isEmpty()) {
            log.debug("Resolution sweep found no unresolved entries");
            return 0;
        }

        int resolvedRegNos = 0;
        for (String regNo : pending) {
            Optional<Identity> identity = identityService.lookup(regNo);
            if (identity.isEmpty()) {
                continue;
            }
            ledgerStore.lockRegNo(regNo);
            if (resolve(identity.get(), UnknownEntriesResolvedEvent.TRIGGER_SWEEP) > 0) {
                resolvedRegNos++;
            }
        }

        gateMetrics.recordSweep(resolvedRegNos);
        log.info("Resolution sweep checked {} regNos, resolved {}", pending.size(), resolvedRegNos);
        return resolvedRegNos;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findUnresolved() {
        return ledgerStore.findUnresolved();
    }

    private int resolve(Identity identity, String trigger) {
        int rows = ledgerStore.resolveUnknown(identity);
        if (rows > 0) {
            Instant at = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
            outboxService.saveEvent(AGGREGATE_TYPE, identity.getRegNo(), UnknownEntriesResolvedEvent.EVENT_TYPE,
                    UnknownEntriesResolvedEvent.of(identity, rows, trigger, at));
            gateMetrics.recordResolvedRows(trigger, rows);
        }
        return rows;
    }
}
