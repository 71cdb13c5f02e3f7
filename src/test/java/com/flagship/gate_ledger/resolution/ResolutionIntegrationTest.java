package com.flagship.gate_ledger.resolution;

import com.flagship.gate_ledger.exception.IdentityConflictException;
import com.flagship.gate_ledger.gate.GateScanService;
import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.identity.IdentityService;
import com.flagship.gate_ledger.identity.IdentityType;
import com.flagship.gate_ledger.ledger.LedgerEntry;
import com.flagship.gate_ledger.ledger.LedgerEntryPersistenceService;
import com.flagship.gate_ledger.ledger.UserType;
import com.flagship.gate_ledger.support.AbstractPostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ResolutionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private ResolutionService resolutionService;

    @Autowired
    private GateScanService gateScanService;

    @Autowired
    private IdentityService identityService;

    @Autowired
    private LedgerEntryPersistenceService ledgerStore;

    @Test
    @DisplayName("Registration only touches unknown rows of its own regNo")
    void register_OnlyOwnUnknownRows() {
        printTestHeader("Resolution isolation");

        gateScanService.scan("X1");
        gateScanService.scan("X1");
        gateScanService.scan("X1");
        gateScanService.scan("Y2");

        assertEquals(3, resolutionService.registerAndResolve(Identity.ofClassified("X1", "Ravi", "MECH", null)));

        List<LedgerEntry> x1 = ledgerStore.findByRegNo("X1");
        assertEquals(2, x1.size());
        assertTrue(x1.stream().allMatch(e -> "Ravi".equals(e.getName()) && e.getUserType() == UserType.STAFF));

        LedgerEntry y2 = ledgerStore.findByRegNo("Y2").get(0);
        assertTrue(y2.isUnknown());
        assertEquals(List.of("Y2"), ledgerStore.findUnresolvedRegNos());
        printSuccess("Only X1 rows were resolved");
    }

    @Test
    @DisplayName("Rows that already carry an identity are never overwritten")
    void register_DoesNotOverwriteResolvedRows() {
        identityService.upsert(Identity.of("22B9", "Old Name", "CIVIL", IdentityType.STUDENT));
        LedgerEntry known = gateScanService.scan("22B9").getEntry();

        assertEquals(0, resolutionService.registerAndResolve(Identity.of("22B9", "New Name", "EEE", IdentityType.STUDENT)));

        LedgerEntry reloaded = ledgerStore.findById(known.getId()).orElseThrow();
        assertEquals("Old Name", reloaded.getName());
        assertEquals("CIVIL", reloaded.getDepartment());
        assertEquals("New Name", identityService.lookup("22B9").orElseThrow().getName());
    }

    @Test
    @DisplayName("Sweep resolves newly registered regNos once and is idempotent")
    void sweep_Idempotent() {
        gateScanService.scan("P1");
        gateScanService.scan("P1");
        gateScanService.scan("P1");
        gateScanService.scan("Q2");
        gateScanService.scan("33C1");

        identityService.upsert(Identity.of("P1", "Priya", "CSE", IdentityType.STAFF));
        identityService.upsert(Identity.of("33C1", "Kiran", "IT", IdentityType.STUDENT));

        assertEquals(2, resolutionService.sweepUnresolved());
        assertEquals(0, resolutionService.sweepUnresolved());

        assertEquals(List.of("Q2"), ledgerStore.findUnresolvedRegNos());
        assertEquals(1, resolutionService.findUnresolved().size());
    }

    @Test
    @DisplayName("Registering a regNo under the other variant is rejected")
    void register_OtherVariant_Conflict() {
        identityService.upsert(Identity.of("S5", "Meera", "CSE", IdentityType.STAFF));
        gateScanService.scan("S5");

        assertThrows(IdentityConflictException.class,
                () -> resolutionService.registerAndResolve(Identity.of("S5", "Meera", "CSE", IdentityType.STUDENT)));
        assertEquals(IdentityType.STAFF, identityService.lookup("S5").orElseThrow().getType());
    }

    @Test
    @DisplayName("Bulk delete removes identities whatever their variant")
    void deleteMany_BothVariants() {
        identityService.upsertAll(List.of(
                Identity.of("S5", "Meera", "CSE", IdentityType.STAFF),
                Identity.of("55A", "Dev", "ECE", IdentityType.STUDENT)));

        assertEquals(3, identityService.deleteMany(List.of("S5", "55A", "NOPE")));

        assertTrue(identityService.lookup("S5").isEmpty());
        assertTrue(identityService.lookup("55A").isEmpty());
        assertTrue(identityService.findAllByType(IdentityType.STAFF).isEmpty());
    }

    @Test
    @DisplayName("Concurrent first registrations of one regNo end in one identity and clean conflicts")
    void concurrentRegistrations_SameRegNo_NoDuplicateKeyFailure() throws Exception {
        printTestHeader("Concurrent registrations of one regNo");

        gateScanService.scan("R7");

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                IdentityType type = i % 2 == 0 ? IdentityType.STAFF : IdentityType.STUDENT;
                futures.add(executor.submit(() -> {
                    start.await();
                    return resolutionService.registerAndResolve(Identity.of("R7", "Kavya", "CIVIL", type));
                }));
            }
            start.countDown();

            int registered = 0;
            int conflicts = 0;
            int resolvedRows = 0;
            for (Future<Integer> future : futures) {
                try {
                    resolvedRows += future.get(30, TimeUnit.SECONDS);
                    registered++;
                } catch (ExecutionException e) {
                    assertInstanceOf(IdentityConflictException.class, e.getCause());
                    conflicts++;
                }
            }

            assertEquals(threads / 2, registered);
            assertEquals(threads / 2, conflicts);
            assertEquals(1, resolvedRows);

            Identity stored = identityService.lookup("R7").orElseThrow();
            LedgerEntry entry = ledgerStore.findByRegNo("R7").get(0);
            assertEquals(UserType.of(stored.getType()), entry.getUserType());
            printSuccess("Registered as " + stored.getType() + " with " + conflicts + " conflicts");
        } finally {
            executor.shutdownNow();
        }
    }
}
