package com.flagship.split_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ExpenseDraft;
import com.flagship.split_ledger.ledger.ExpenseLedger;
import com.flagship.split_ledger.ledger.LedgerService;
import com.flagship.split_ledger.ledger.ParticipantService;
import com.flagship.split_ledger.ledger.ParticipantShare;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against a real Kafka broker.
 *
 * These tests verify that:
 * - Recorded and voided expenses reach the ledger events topic
 * - Events are marked as published after a successful send
 * - Events are keyed by ledger id and carry their type in a header
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxKafkaIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("split_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("split-ledger.fx.source", () -> "offline");
        // Keep the scheduled poll out of the way, we'll trigger manually
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    private static final CurrencyCode ILS = CurrencyCode.of("ILS");

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ParticipantService participantService;

    @Autowired
    private ExpenseLedger expenseLedger;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private KafkaConsumer<String, String> consumer;
    private long ledgerId;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        ledgerId = ThreadLocalRandom.current().nextLong(1_000_000L, Long.MAX_VALUE);
        ledgerService.ensureLedger(ledgerId, ILS);
        participantService.ensureMember(ledgerId, 1L, "Alice");
        participantService.ensureMember(ledgerId, 2L, "Bob");

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(ledgerEventsTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Topic: " + ledgerEventsTopic + ", ledger: " + ledgerId);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Expense recordExpense(String amount) {
        ExpenseDraft draft = ExpenseDraft.of(1L, new BigDecimal(amount), ILS,
            List.of(ParticipantShare.equal(1L), ParticipantShare.equal(2L)), "food", null, Instant.now());
        return expenseLedger.addExpense(ledgerId, draft);
    }

    @Test
    @DisplayName("Publisher should send ledger events to Kafka and mark them published")
    void testPublisher_SendsToKafka() throws Exception {
        printTestHeader("Publisher Sends Events to Kafka");

        Expense expense = recordExpense("120");
        expenseLedger.voidExpense(ledgerId, expense.getId());

        long unpublishedBefore = outboxEventRepository.countUnpublished();
        System.out.println("Unpublished events before: " + unpublishedBefore);
        assertEquals(2, unpublishedBefore);

        outboxPublisher.publishPending();

        assertEquals(0, outboxEventRepository.countUnpublished(), "All events should be published");

        List<ConsumerRecord<String, String>> records = consumeRecords(2, 10_000);
        records.forEach(r -> System.out.println("Key: " + r.key() + ", Partition: " + r.partition() + ", Value: " + r.value()));

        assertEquals(2, records.size());
        assertEquals(List.of("ExpenseRecorded", "ExpenseVoided"), records.stream()
            .map(r -> new String(r.headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8))
            .toList());
        records.forEach(r -> assertEquals(Long.toString(ledgerId), r.key(), "Message key should be the ledger id"));
        assertEquals(expense.getId().longValue(),
            objectMapper.readTree(records.get(0).value()).get("expenseId").asLong());

        printSuccess("Events published in order on the ledger's partition");
    }

    @Test
    @DisplayName("Events of one ledger should share a partition")
    void testPublisher_SamePartitionPerLedger() {
        printTestHeader("Publisher Keeps Ledger On One Partition");

        for (int i = 0; i < 3; i++) {
            recordExpense("10");
        }
        outboxPublisher.publishPending();

        List<ConsumerRecord<String, String>> records = consumeRecords(3, 10_000);

        assertEquals(3, records.size());
        assertEquals(1, records.stream().map(ConsumerRecord::partition).distinct().count());

        printSuccess("All events of the ledger on one partition");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (record.key().equals(Long.toString(ledgerId))) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
