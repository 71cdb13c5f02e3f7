package com.flagship.gate_ledger.gate.event;

import com.flagship.gate_ledger.identity.Identity;
import com.flagship.gate_ledger.ledger.UserType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when previously UNKNOWN entries of a regNo receive an identity.
 * Only written when at least one row changed.
 */
@Value
public class UnknownEntriesResolvedEvent implements GateEvent {
    UUID eventId;
    String regNo;
    String name;
    String department;
    String userType;
    int resolvedRows;
    String trigger;
    Instant occurredAt;

    public static final String EVENT_TYPE = "UnknownEntriesResolved";

    public static final String TRIGGER_REGISTRATION = "REGISTRATION";
    public static final String TRIGGER_SWEEP = "SWEEP";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static UnknownEntriesResolvedEvent of(Identity identity, int resolvedRows, String trigger, Instant at) {
        return new UnknownEntriesResolvedEvent(
            UUID.randomUUID(),
            identity.getRegNo(),
            identity.getName(),
            identity.getDepartment(),
            UserType.of(identity.getType()).name(),
            resolvedRows,
            trigger,
            at
        );
    }
}
