package com.flagship.gate_ledger.gate;

/**
 * What closed a ledger entry.
 */
public enum CheckoutSource {
    /** Second scan of the same regNo. */
    SCAN,
    /** Operator closed one entry. */
    MANUAL,
    /** Operator closed every open entry, e.g. at end of day. */
    BULK
}
