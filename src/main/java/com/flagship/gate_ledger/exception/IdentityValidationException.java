package com.flagship.gate_ledger.exception;

import lombok.Getter;

/**
 * Raised when an identity is missing a required field.
 */
@Getter
public class IdentityValidationException extends IllegalArgumentException {

    private final String field;

    public IdentityValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
