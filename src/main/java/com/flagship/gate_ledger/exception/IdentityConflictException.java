package com.flagship.gate_ledger.exception;

import com.flagship.gate_ledger.identity.IdentityType;
import lombok.Getter;

/**
 * Raised when a regNo is upserted under one variant while it is already
 * registered under the other.
 */
@Getter
public class IdentityConflictException extends IllegalStateException {

    private final String regNo;
    private final IdentityType existingType;

    public IdentityConflictException(String regNo, IdentityType existingType, IdentityType requestedType) {
        super(String.format("Registration number %s is already registered as %s, cannot register it as %s",
            regNo, existingType, requestedType));
        this.regNo = regNo;
        this.existingType = existingType;
    }
}
