package com.flagship.gate_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * Written in the same transaction as the ledger change it describes, then
 * published to Kafka by {@link OutboxPublisher}. The aggregate id is the
 * regNo, which doubles as the Kafka key.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g., "LedgerEntry"
    String aggregateId;        // regNo
    String eventType;          // e.g., "EntryCheckedIn"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
