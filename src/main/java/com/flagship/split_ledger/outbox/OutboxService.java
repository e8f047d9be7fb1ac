package com.flagship.split_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox and tracks their publication.
 *
 * {@link #append} joins the caller's transaction, so an event exists exactly
 * when the change it describes was committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Serializes the payload and stores it as a pending event.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         if called outside a transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(String aggregateType, long aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType,
            toJson(payload), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Outbox event stored: type={}, aggregate={}:{}", eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    /**
     * Locks and returns the next unpublished events. The locks last as long as
     * the caller's transaction, so the outcome of each send has to be recorded
     * in that same transaction.
     */
    @Transactional
    public List<OutboxEvent> nextBatch(int limit, int maxAttempts) {
        return repository.lockNextBatch(limit, maxAttempts)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional
    public void recordFailure(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.recordFailure(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt {}): {}",
                eventId, entity.getAttempts(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(String aggregateType, long aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    /**
     * Deletes events published before the cutoff.
     *
     * @return number of rows deleted
     */
    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int deleted = repository.deletePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }
}
