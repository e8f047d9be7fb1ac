package com.flagship.split_ledger.outbox;

import com.flagship.split_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes pending ledger events to Kafka.
 *
 * Events are keyed by ledger id, so all events of one ledger land on the same
 * partition. A batch is published inside one transaction: its rows stay locked
 * until their outcome is recorded, and a concurrent publisher skips them. Each
 * send is awaited before the next one starts. Once an event of a ledger fails,
 * the ledger's later events in the batch are held back, so a ledger's events
 * reach Kafka in commit order. An event that keeps failing stops being picked
 * up once it reaches the attempt limit and shows up in the dead-letter gauge
 * instead; the ledger's later events then go out without it.
 *
 * With several publisher instances each batch is ordered, but two instances
 * may interleave events of the same ledger.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_TYPE_HEADER = "event_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-attempts:5}")
    private int maxAttempts;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention:P7D}")
    private Duration retention;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    @Transactional
    public void publishPending() {
        List<OutboxEvent> batch = outboxService.nextBatch(batchSize, maxAttempts);
        if (batch.isEmpty()) {
            return;
        }
        log.debug("Publishing {} outbox events", batch.size());
        Set<Long> heldBack = new HashSet<>();
        for (OutboxEvent event : batch) {
            if (heldBack.contains(event.getAggregateId())) {
                log.debug("Holding back outbox event {} behind a failed event of ledger {}",
                    event.getId(), event.getAggregateId());
                continue;
            }
            if (!publish(event)) {
                heldBack.add(event.getAggregateId());
            }
        }
    }

    @Scheduled(cron = "${outbox.cleanup.cron:0 30 3 * * *}")
    public void purgePublished() {
        outboxService.purgePublishedBefore(clock.instant().minus(retention));
    }

    /**
     * @return whether the event reached Kafka
     */
    private boolean publish(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            ledgerEventsTopic, Long.toString(event.getAggregateId()), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published outbox event {} ({}) to {}-{}@{}",
                event.getId(), event.getEventType(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            recordFailure(event, e.getCause() != null ? e.getCause().getMessage() : e.toString());
        } catch (KafkaException e) {
            // Thrown by send() itself, before a future exists
            recordFailure(event, e.getMessage());
        }
        return false;
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.recordFailure(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getAttempts() + 1 >= maxAttempts) {
            log.error("Outbox event {} reached {} attempts and will not be retried: ledgerId={}, eventType={}",
                event.getId(), maxAttempts, event.getAggregateId(), event.getEventType());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
