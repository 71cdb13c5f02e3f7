package com.flagship.gate_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntryNotFoundException extends RuntimeException {

    private final UUID entryId;

    public EntryNotFoundException(UUID entryId) {
        super("Ledger entry not found: " + entryId);
        this.entryId = entryId;
    }
}
