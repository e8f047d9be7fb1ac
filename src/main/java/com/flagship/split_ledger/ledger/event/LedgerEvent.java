package com.flagship.split_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events published about a ledger.
 */
public interface LedgerEvent {

    /**
     * Unique id of this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * The ledger this event is about. Also the Kafka partition key.
     */
    long getLedgerId();

    Instant getOccurredAt();

    String getEventType();
}
