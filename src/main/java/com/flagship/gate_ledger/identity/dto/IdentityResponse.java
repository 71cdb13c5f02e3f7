package com.flagship.gate_ledger.identity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.identity.IdentityType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IdentityResponse {

    @JsonProperty("regNo")
    String regNo;

    @JsonProperty("name")
    String name;

    @JsonProperty("department")
    String department;

    @JsonProperty("type")
    IdentityType type;

    public static IdentityResponse from(Identity identity) {
        return IdentityResponse.builder()
            .regNo(identity.getRegNo())
            .name(identity.getName())
            .department(identity.getDepartment())
            .type(identity.getType())
            .build();
    }

    public static List<IdentityResponse> fromAll(List<Identity> identities) {
        return identities.stream()
            .map(IdentityResponse::from)
            .toList();
    }
}
