package com.flagship.gate_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gate_ledger.gate.ScanDirection;
import com.flagship.gate_ledger.gate.ScanResult;
import com.flagship.gate_ledger.ledger.UserType;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a scan: which way the person went, and the entry that was
 * created (IN) or closed (OUT).
 */
@Value
@Builder
public class ScanResponse {

    @JsonProperty("status")
    ScanDirection status;

    @JsonProperty("regNo")
    String regNo;

    @JsonProperty("name")
    String name;

    @JsonProperty("userType")
    UserType userType;

    @JsonProperty("entry")
    LedgerEntryResponse entry;

    public static ScanResponse from(ScanResult result) {
        return ScanResponse.builder()
            .status(result.getDirection())
            .regNo(result.getEntry().getRegNo())
            .name(result.getEntry().getName())
            .userType(result.getEntry().getUserType())
            .entry(LedgerEntryResponse.from(result.getEntry()))
            .build();
    }
}
