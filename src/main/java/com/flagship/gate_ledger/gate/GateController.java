package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.gate.dto.LedgerEntryResponse;
import com.flagship.gate_ledger.gate.dto.ScanRequest;
import com.flagship.gate_ledger.gate.dto.ScanResponse;
import com.flagship.gate_ledger.ledger.LedgerEntryPersistenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for the gate: scans, the ledger, and manual checkout.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class GateController {

    private final GateScanService gateScanService;
    private final CheckoutService checkoutService;
    private final LedgerEntryPersistenceService ledgerStore;

    /**
     * Records a scan.
     *
     * @return 201 with the new entry when the person came in, 200 with the
     *         closed entry when they went out
     */
    @PostMapping("/scans")
    public ResponseEntity<ScanResponse> scan(@Valid @RequestBody ScanRequest request) {
        log.debug("Received scan request");

        ScanResult result = gateScanService.scan(request.getRegNo());

        HttpStatus status = result.getDirection() == ScanDirection.IN ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ScanResponse.from(result));
    }

    /**
     * Lists ledger entries ordered by check-in time, optionally for one regNo.
     */
    @GetMapping("/entries")
    public ResponseEntity<List<LedgerEntryResponse>> listEntries(
            @RequestParam(value = "regNo", required = false) String regNo) {
        if (regNo == null || regNo.isBlank()) {
            return ResponseEntity.ok(LedgerEntryResponse.fromAll(ledgerStore.findAll()));
        }
        return ResponseEntity.ok(LedgerEntryResponse.fromAll(ledgerStore.findByRegNo(regNo.trim())));
    }

    @GetMapping("/entries/open")
    public ResponseEntity<List<LedgerEntryResponse>> listOpenEntries() {
        return ResponseEntity.ok(LedgerEntryResponse.fromAll(ledgerStore.findOpen()));
    }

    @PutMapping("/entries/{id}/checkout")
    public ResponseEntity<LedgerEntryResponse> checkout(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(LedgerEntryResponse.from(checkoutService.closeEntry(id)));
    }

    @PutMapping("/entries/checkout-all")
    public ResponseEntity<Map<String, Integer>> checkoutAll() {
        int closed = checkoutService.closeAllOpen();
        return ResponseEntity.ok(Map.of("closedCount", closed));
    }
}
