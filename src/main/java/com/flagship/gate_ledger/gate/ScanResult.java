package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.ledger.LedgerEntry;
import lombok.Value;

@Value
public class ScanResult {
    LedgerEntry entry;
    ScanDirection direction;

    public static ScanResult checkedIn(LedgerEntry entry) {
        return new ScanResult(entry, ScanDirection.IN);
    }

    public static ScanResult checkedOut(LedgerEntry entry) {
        return new ScanResult(entry, ScanDirection.OUT);
    }
}
