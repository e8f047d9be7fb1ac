package com.flagship.split_ledger.outbox;

import com.flagship.split_ledger.observability.OutboxMetrics;
import com.flagship.split_ledger.support.MutableClock;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour on successful and failed sends, with Kafka mocked out.
 * {@link OutboxKafkaIntegrationTest} covers a real broker.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final Instant NOW = Instant.parse("2024-06-10T08:00:00Z");

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics, new MutableClock(NOW));
        ReflectionTestUtils.setField(publisher, "ledgerEventsTopic", "ledger-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxAttempts", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
        ReflectionTestUtils.setField(publisher, "retention", Duration.ofDays(7));
    }

    private static OutboxEvent event(long ledgerId, int attempts) {
        return new OutboxEvent(UUID.randomUUID(), "Ledger", ledgerId, "ExpenseRecorded",
            "{\"ledgerId\":" + ledgerId + "}", NOW, null, attempts, null, 1L);
    }

    @Test
    @DisplayName("Should key records by ledger id and mark them published")
    void shouldPublishKeyedByLedger() {
        OutboxEvent event = event(77L, 0);
        when(outboxService.nextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0);
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        });

        publisher.publishPending();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> sent = captor.getValue();
        assertEquals("ledger-events", sent.topic());
        assertEquals("77", sent.key());
        assertEquals(event.getPayload(), sent.value());
        assertEquals("ExpenseRecorded", new String(
            sent.headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("ExpenseRecorded");
    }

    @Test
    @DisplayName("Should record a failed send and leave the event pending")
    void shouldRecordFailure() {
        OutboxEvent event = event(77L, 1);
        when(outboxService.nextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        publisher.publishPending();

        verify(outboxService).recordFailure(event.getId(), "broker down");
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("ExpenseRecorded");
        verify(outboxMetrics, never()).recordEventDeadLettered(any());
    }

    @Test
    @DisplayName("Should count an event as dead-lettered on its last allowed attempt")
    void shouldDeadLetterOnLastAttempt() {
        OutboxEvent event = event(77L, 4);
        when(outboxService.nextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        publisher.publishPending();

        verify(outboxMetrics).recordEventDeadLettered("ExpenseRecorded");
    }

    @Test
    @DisplayName("Should hold back a ledger's later events after one of them fails")
    void shouldHoldBackLedgerAfterFailure() {
        OutboxEvent firstOf77 = event(77L, 0);
        OutboxEvent secondOf77 = event(77L, 0);
        OutboxEvent onlyOf88 = event(88L, 0);
        when(outboxService.nextBatch(100, 5)).thenReturn(List.of(firstOf77, secondOf77, onlyOf88));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            if ("77".equals(record.key())) {
                return CompletableFuture.failedFuture(new KafkaException("broker down"));
            }
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0);
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        });

        publisher.publishPending();

        // Ledger 77 is tried once; ledger 88 is unaffected
        verify(kafkaTemplate, times(2)).send(any(ProducerRecord.class));
        verify(outboxService).recordFailure(firstOf77.getId(), "broker down");
        verify(outboxService, never()).markPublished(secondOf77.getId());
        verify(outboxService, never()).recordFailure(eq(secondOf77.getId()), any());
        verify(outboxService).markPublished(onlyOf88.getId());
    }

    @Test
    @DisplayName("Should record a failure thrown by send itself")
    void shouldRecordSynchronousSendFailure() {
        OutboxEvent event = event(77L, 0);
        when(outboxService.nextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new KafkaException("metadata timeout"));

        publisher.publishPending();

        verify(outboxService).recordFailure(event.getId(), "metadata timeout");
        verify(outboxMetrics).recordEventPublishFailed("ExpenseRecorded");
    }

    @Test
    @DisplayName("Should do nothing for an empty outbox")
    void shouldSkipEmptyBatch() {
        when(outboxService.nextBatch(anyInt(), anyInt())).thenReturn(List.of());

        publisher.publishPending();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }

    @Test
    @DisplayName("Should purge events published before the retention window")
    void shouldPurgeWithRetention() {
        publisher.purgePublished();

        verify(outboxService).purgePublishedBefore(NOW.minus(Duration.ofDays(7)));
    }
}
