package com.flagship.gate_ledger.identity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class BulkDeleteRequest {

    @NotNull(message = "Registration numbers are required")
    @JsonProperty("regNos")
    List<String> regNos;

    @JsonCreator
    public BulkDeleteRequest(@JsonProperty("regNos") List<String> regNos) {
        this.regNos = regNos;
    }
}
