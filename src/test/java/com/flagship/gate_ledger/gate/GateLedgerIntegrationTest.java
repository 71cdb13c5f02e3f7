package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.exception.EntryNotFoundException;
import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.identity.IdentityService;
import com.flagship.gate_ledger.identity.IdentityType;
import com.flagship.gate_ledger.ledger.LedgerEntry;
import com.flagship.gate_ledger.ledger.LedgerEntryPersistenceService;
import com.flagship.gate_ledger.ledger.UserType;
import com.flagship.gate_ledger.resolution.ResolutionService;
import com.flagship.gate_ledger.support.AbstractPostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scan toggling and manual checkout against a real database.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class GateLedgerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private GateScanService gateScanService;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private ResolutionService resolutionService;

    @Autowired
    private IdentityService identityService;

    @Autowired
    private LedgerEntryPersistenceService ledgerStore;

    @Test
    @DisplayName("Unknown scan in and out, then registration resolves the entry")
    void unknownVisitor_ScannedTwice_ThenRegistered() {
        printTestHeader("Unknown visitor resolved after registration");

        ScanResult in = gateScanService.scan("S101");
        assertEquals(ScanDirection.IN, in.getDirection());
        assertEquals(UserType.UNKNOWN, in.getEntry().getUserType());
        assertNull(in.getEntry().getCheckOutTime());

        ScanResult out = gateScanService.scan("S101");
        assertEquals(ScanDirection.OUT, out.getDirection());
        assertEquals(in.getEntry().getId(), out.getEntry().getId());
        assertNotNull(out.getEntry().getCheckOutTime());

        int rows = resolutionService.registerAndResolve(Identity.of("S101", "A", "CSE", IdentityType.STUDENT));
        assertEquals(1, rows);

        LedgerEntry resolved = ledgerStore.findById(in.getEntry().getId()).orElseThrow();
        assertEquals("A", resolved.getName());
        assertEquals("CSE", resolved.getDepartment());
        assertEquals(UserType.STUDENT, resolved.getUserType());
        assertEquals(in.getEntry().getCheckInTime(), resolved.getCheckInTime());
        assertEquals(out.getEntry().getCheckOutTime(), resolved.getCheckOutTime());

        assertEquals(0, resolutionService.sweepUnresolved());
        printSuccess("Entry resolved with timestamps unchanged");
    }

    @Test
    @DisplayName("Scans of one regNo alternate IN and OUT")
    void scans_Alternate() {
        identityService.upsert(Identity.of("22BCE1001", "Asha", "ECE", IdentityType.STUDENT));

        List<ScanDirection> directions = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            directions.add(gateScanService.scan("22BCE1001").getDirection());
        }

        assertEquals(List.of(ScanDirection.IN, ScanDirection.OUT, ScanDirection.IN, ScanDirection.OUT,
                ScanDirection.IN), directions);

        List<LedgerEntry> entries = ledgerStore.findByRegNo("22BCE1001");
        assertEquals(3, entries.size());
        assertEquals(1, entries.stream().filter(LedgerEntry::isOpen).count());
        assertTrue(entries.stream().allMatch(e -> e.getUserType() == UserType.STUDENT));
    }

    @Test
    @DisplayName("Scans of different regNos do not affect each other")
    void scans_IndependentPerRegNo() {
        gateScanService.scan("A1");
        gateScanService.scan("B2");
        gateScanService.scan("A1");

        assertTrue(ledgerStore.findOpenEntry("A1").isEmpty());
        assertTrue(ledgerStore.findOpenEntry("B2").isPresent());
    }

    @Test
    @DisplayName("Concurrent scans of one regNo never leave two open entries")
    void concurrentScans_SameRegNo_Linearized() throws Exception {
        printTestHeader("Concurrent scans of one regNo");

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ScanResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return gateScanService.scan("C42");
                }));
            }
            start.countDown();

            int in = 0;
            int out = 0;
            for (Future<ScanResult> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).getDirection() == ScanDirection.IN) {
                    in++;
                } else {
                    out++;
                }
            }

            assertEquals(threads / 2, in);
            assertEquals(threads / 2, out);
            List<LedgerEntry> entries = ledgerStore.findByRegNo("C42");
            assertEquals(threads / 2, entries.size());
            assertTrue(entries.stream().noneMatch(LedgerEntry::isOpen));
            printSuccess("Scans serialized: " + in + " in, " + out + " out");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Bulk checkout closes open entries once and leaves closed ones alone")
    void closeAllOpen_Twice() {
        gateScanService.scan("A1");
        gateScanService.scan("B2");
        gateScanService.scan("C3");
        LedgerEntry closedEarlier = gateScanService.scan("C3").getEntry();

        assertEquals(2, checkoutService.closeAllOpen());
        assertEquals(0, checkoutService.closeAllOpen());

        assertTrue(ledgerStore.findOpen().isEmpty());
        LedgerEntry untouched = ledgerStore.findById(closedEarlier.getId()).orElseThrow();
        assertEquals(closedEarlier.getCheckOutTime(), untouched.getCheckOutTime());
    }

    @Test
    @DisplayName("Bulk checkout also closes an entry checked in after its own instant")
    void closeAllOpen_LaterCheckIn_ClosedAtCheckIn() {
        Instant ahead = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.MICROS);
        LedgerEntry later = gateScanService.scan("F1", ahead).getEntry();
        gateScanService.scan("A1");

        assertEquals(2, checkoutService.closeAllOpen());

        assertTrue(ledgerStore.findOpen().isEmpty());
        LedgerEntry closed = ledgerStore.findById(later.getId()).orElseThrow();
        assertEquals(ahead, closed.getCheckOutTime());
    }

    @Test
    @DisplayName("Manual close of an entry works once")
    void closeEntry_Once() {
        LedgerEntry entry = gateScanService.scan("A1").getEntry();

        LedgerEntry closed = checkoutService.closeEntry(entry.getId());
        assertNotNull(closed.getCheckOutTime());

        assertThrows(IllegalStateException.class, () -> checkoutService.closeEntry(entry.getId()));
        // A new scan starts a fresh visit
        assertEquals(ScanDirection.IN, gateScanService.scan("A1").getDirection());
    }

    @Test
    @DisplayName("Manual close of an unknown id is not found")
    void closeEntry_NotFound() {
        UUID id = UUID.randomUUID();
        EntryNotFoundException e = assertThrows(EntryNotFoundException.class, () -> checkoutService.closeEntry(id));
        assertEquals(id, e.getEntryId());
    }
}
