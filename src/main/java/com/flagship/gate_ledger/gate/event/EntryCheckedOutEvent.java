package com.flagship.gate_ledger.gate.event;

import com.flagship.gate_ledger.gate.CheckoutSource;
import com.flagship.gate_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a ledger entry is closed, by scan or by an operator.
 */
@Value
public class EntryCheckedOutEvent implements GateEvent {
    UUID eventId;
    UUID entryId;
    String regNo;
    String userType;
    Instant checkInTime;
    Instant checkOutTime;
    String source;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntryCheckedOut";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EntryCheckedOutEvent fromEntry(LedgerEntry entry, CheckoutSource source) {
        if (entry.isOpen()) {
            throw new IllegalArgumentException("Entry " + entry.getId() + " is still open");
        }
        return new EntryCheckedOutEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getRegNo(),
            entry.getUserType().name(),
            entry.getCheckInTime(),
            entry.getCheckOutTime(),
            source.name(),
            entry.getCheckOutTime()
        );
    }
}
