package com.flagship.gate_ledger.identity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gate_ledger.identity.IdentityType;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of an identity upsert; the regNo comes from the path.
 * When type is omitted the regNo is classified.
 */
@Value
public class UpsertIdentityRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Department is required")
    @JsonProperty("department")
    String department;

    @JsonProperty("type")
    IdentityType type;

    @JsonCreator
    public UpsertIdentityRequest(@JsonProperty("name") String name,
                                 @JsonProperty("department") String department,
                                 @JsonProperty("type") IdentityType type) {
        this.name = name;
        this.department = department;
        this.type = type;
    }
}
