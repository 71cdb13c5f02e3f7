package com.flagship.gate_ledger.gate;

/**
 * Which transition a scan produced. A regNo with an open entry is IN,
 * otherwise OUT; the state itself is never stored.
 */
public enum ScanDirection {
    IN,
    OUT
}
