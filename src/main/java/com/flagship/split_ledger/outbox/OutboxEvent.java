package com.flagship.split_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published.
 *
 * Rows are written in the same transaction as the change they describe and
 * picked up later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Ledger"
    long aggregateId;          // ledger id
    String eventType;          // ExpenseRecorded, ExpenseVoided
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null while pending
    int attempts;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent pending(String aggregateType, long aggregateId,
                                      String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
