package com.flagship.gate_ledger.ledger;

import com.flagship.gate_ledger.identity.IdentityType;

/**
 * Who a ledger entry was logged against.
 *
 * UNKNOWN marks an entry whose regNo was not in the identity store at scan
 * time. It only ever moves to STUDENT or STAFF, through resolution.
 */
public enum UserType {
    STUDENT,
    STAFF,
    UNKNOWN;

    public static UserType of(IdentityType identityType) {
        return switch (identityType) {
            case STUDENT -> STUDENT;
            case STAFF -> STAFF;
        };
    }
}
