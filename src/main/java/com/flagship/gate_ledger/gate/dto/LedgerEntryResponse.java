package com.flagship.gate_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gate_ledger.ledger.LedgerEntry;
import com.flagship.gate_ledger.ledger.UserType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("regNo")
    String regNo;

    @JsonProperty("name")
    String name;

    @JsonProperty("department")
    String department;

    @JsonProperty("userType")
    UserType userType;

    @JsonProperty("checkInTime")
    Instant checkInTime;

    @JsonProperty("checkOutTime")
    Instant checkOutTime;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .regNo(entry.getRegNo())
            .name(entry.getName())
            .department(entry.getDepartment())
            .userType(entry.getUserType())
            .checkInTime(entry.getCheckInTime())
            .checkOutTime(entry.getCheckOutTime())
            .build();
    }

    public static List<LedgerEntryResponse> fromAll(List<LedgerEntry> entries) {
        return entries.stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }
}
