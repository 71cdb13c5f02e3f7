package com.flagship.gate_ledger.gate.event;

import com.flagship.gate_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a scan opens a new ledger entry. userType is UNKNOWN for
 * regNos missing from the identity store.
 */
@Value
public class EntryCheckedInEvent implements GateEvent {
    UUID eventId;
    UUID entryId;
    String regNo;
    String name;
    String department;
    String userType;
    Instant checkInTime;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntryCheckedIn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EntryCheckedInEvent fromEntry(LedgerEntry entry) {
        return new EntryCheckedInEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getRegNo(),
            entry.getName(),
            entry.getDepartment(),
            entry.getUserType().name(),
            entry.getCheckInTime(),
            entry.getCheckInTime()
        );
    }
}
