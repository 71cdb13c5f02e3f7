package com.flagship.gate_ledger.ledger;

import com.flagship.gate_ledger.identity.Identity;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One check-in/check-out record.
 *
 * Immutable: every transition returns a new instance.
 * - checkInTime is fixed at creation
 * - checkOutTime goes from null to a value exactly once
 * - identity fields go from unknown to known exactly once, through the
 *   ledger store's conditional resolve update
 */
@Value
public class LedgerEntry {
    UUID id;
    String regNo;
    String name;
    String department;
    UserType userType;
    Instant checkInTime;
    Instant checkOutTime;

    /**
     * Creates an open entry. A null identity logs the scan as UNKNOWN.
     */
    public static LedgerEntry checkIn(String regNo, Identity identity, Instant at) {
        if (regNo == null || regNo.isBlank()) {
            throw new IllegalArgumentException("Registration number is required");
        }
        if (at == null) {
            throw new IllegalArgumentException("Check-in time is required");
        }
        if (identity == null) {
            return new LedgerEntry(UUID.randomUUID(), regNo, null, null, UserType.UNKNOWN, at, null);
        }
        return new LedgerEntry(
            UUID.randomUUID(),
            regNo,
            identity.getName(),
            identity.getDepartment(),
            UserType.of(identity.getType()),
            at,
            null
        );
    }

    /**
     * Closes this entry. Identity fields are carried over untouched.
     *
     * @throws IllegalStateException if the entry is already closed
     */
    public LedgerEntry checkOut(Instant at) {
        if (!isOpen()) {
            throw new IllegalStateException(
                String.format("Ledger entry %s was already checked out at %s", id, checkOutTime));
        }
        if (at == null) {
            throw new IllegalArgumentException("Check-out time is required");
        }
        if (at.isBefore(checkInTime)) {
            throw new IllegalArgumentException(
                String.format("Check-out time %s is before check-in time %s", at, checkInTime));
        }
        return new LedgerEntry(id, regNo, name, department, userType, checkInTime, at);
    }

    public boolean isOpen() {
        return checkOutTime == null;
    }

    public boolean isUnknown() {
        return name == null;
    }
}
