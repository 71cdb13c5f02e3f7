package com.flagship.gate_ledger.resolution;

import com.flagship.gate_ledger.gate.dto.LedgerEntryResponse;
import com.flagship.gate_ledger.resolution.dto.RegisterIdentityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for entries logged under an unregistered regNo.
 */
@RestController
@RequestMapping("/api/unknown-entries")
@RequiredArgsConstructor
public class ResolutionController {

    private final ResolutionService resolutionService;

    @GetMapping
    public ResponseEntity<List<LedgerEntryResponse>> listUnresolved() {
        return ResponseEntity.ok(LedgerEntryResponse.fromAll(resolutionService.findUnresolved()));
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, Integer>> register(@Valid @RequestBody RegisterIdentityRequest request) {
        int rows = resolutionService.registerAndResolve(request.toIdentity());
        return ResponseEntity.ok(Map.of("resolvedRows", rows));
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Integer>> sync() {
        return ResponseEntity.ok(Map.of("resolvedCount", resolutionService.sweepUnresolved()));
    }
}
