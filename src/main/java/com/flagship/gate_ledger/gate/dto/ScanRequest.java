package com.flagship.gate_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * A registration number read at the gate.
 */
@Value
public class ScanRequest {

    @NotBlank(message = "Registration number is required")
    @JsonProperty("regNo")
    String regNo;

    @JsonCreator
    public ScanRequest(@JsonProperty("regNo") String regNo) {
        this.regNo = regNo;
    }
}
