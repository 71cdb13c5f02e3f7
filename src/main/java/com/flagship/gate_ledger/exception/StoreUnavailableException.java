package com.flagship.gate_ledger.exception;

/**
 * The persistence layer could not be reached. Never retried by the service.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
