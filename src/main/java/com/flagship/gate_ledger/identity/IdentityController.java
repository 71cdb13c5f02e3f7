package com.flagship.gate_ledger.identity;

import com.flagship.gate_ledger.identity.dto.BulkDeleteRequest;
import com.flagship.gate_ledger.identity.dto.IdentityRecord;
import com.flagship.gate_ledger.identity.dto.IdentityResponse;
import com.flagship.gate_ledger.identity.dto.ImportIdentitiesRequest;
import com.flagship.gate_ledger.identity.dto.UpsertIdentityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

/**
 * REST controller for student and staff master data.
 */
@RestController
@RequestMapping("/api/identities")
@RequiredArgsConstructor
public class IdentityController {

    private final IdentityService identityService;

    @GetMapping
    public ResponseEntity<List<IdentityResponse>> listIdentities(@RequestParam("type") IdentityType type) {
        return ResponseEntity.ok(IdentityResponse.fromAll(identityService.findAllByType(type)));
    }

    @GetMapping("/{regNo}")
    public ResponseEntity<IdentityResponse> getIdentity(@PathVariable("regNo") String regNo) {
        return identityService.lookup(regNo)
            .map(identity -> ResponseEntity.ok(IdentityResponse.from(identity)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * The variant a regNo would be registered under when none is given.
     */
    @GetMapping("/{regNo}/type")
    public ResponseEntity<Map<String, Object>> classify(@PathVariable("regNo") String regNo) {
        return ResponseEntity.ok(Map.of("regNo", regNo.trim(), "type", identityService.classify(regNo)));
    }

    /**
     * Creates or overwrites an identity. A type that disagrees with an
     * existing record of the same regNo is rejected with 409.
     */
    @PutMapping("/{regNo}")
    public ResponseEntity<IdentityResponse> upsertIdentity(
            @PathVariable("regNo") String regNo,
            @Valid @RequestBody UpsertIdentityRequest request) {
        Identity identity = Identity.ofClassified(regNo, request.getName(), request.getDepartment(), request.getType());
        return ResponseEntity.ok(IdentityResponse.from(identityService.upsert(identity)));
    }

    @PostMapping("/import")
    public ResponseEntity<Map<String, Integer>> importIdentities(@Valid @RequestBody ImportIdentitiesRequest request) {
        List<Identity> identities = request.getIdentities()
            .stream()
            .map(IdentityRecord::toIdentity)
            .toList();
        return ResponseEntity.ok(Map.of("importedCount", identityService.upsertAll(identities)));
    }

    @PostMapping("/bulk-delete")
    public ResponseEntity<Map<String, Integer>> deleteIdentities(@Valid @RequestBody BulkDeleteRequest request) {
        return ResponseEntity.ok(Map.of("deletedCount", identityService.deleteMany(request.getRegNos())));
    }
}
