package com.flagship.gate_ledger.gate.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for gate ledger events.
 *
 * Events are keyed by regNo so that every event about one person lands on
 * the same Kafka partition, in order.
 */
public interface GateEvent {

    /**
     * Unique identifier for this event instance, for consumer deduplication.
     */
    UUID getEventId();

    String getRegNo();

    Instant getOccurredAt();

    String getEventType();
}
