package com.flagship.gate_ledger.identity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ImportIdentitiesRequest {

    @NotNull(message = "Identities are required")
    @JsonProperty("identities")
    List<@Valid IdentityRecord> identities;

    @JsonCreator
    public ImportIdentitiesRequest(@JsonProperty("identities") List<IdentityRecord> identities) {
        this.identities = identities;
    }
}
