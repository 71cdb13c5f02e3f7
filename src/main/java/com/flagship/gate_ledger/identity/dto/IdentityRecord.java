package com.flagship.gate_ledger.identity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.identity.IdentityType;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * A full identity as submitted by a client, for import and registration.
 */
@Value
public class IdentityRecord {

    @NotBlank(message = "Registration number is required")
    @JsonProperty("regNo")
    String regNo;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Department is required")
    @JsonProperty("department")
    String department;

    @JsonProperty("type")
    IdentityType type;

    @JsonCreator
    public IdentityRecord(@JsonProperty("regNo") String regNo,
                          @JsonProperty("name") String name,
                          @JsonProperty("department") String department,
                          @JsonProperty("type") IdentityType type) {
        this.regNo = regNo;
        this.name = name;
        this.department = department;
        this.type = type;
    }

    public Identity toIdentity() {
        return Identity.ofClassified(regNo, name, department, type);
    }
}
