package com.flagship.split_ledger.observability;

import com.flagship.split_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and publish counters.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * Prometheus scrape never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxAttempts;

    private final AtomicLong backlog = new AtomicLong();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-attempts:5}") int maxAttempts) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxAttempts = maxAttempts;

        Gauge.builder("outbox.backlog.size", backlog, AtomicLong::get)
            .description("Ledger events waiting to be published")
            .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished ledger event")
            .register(meterRegistry);
        Gauge.builder("outbox.events.dead_lettered", deadLettered, AtomicLong::get)
            .description("Ledger events that reached the publish attempt limit")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            backlog.set(outboxRepository.countUnpublished());
            oldestPendingAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                .orElse(0L));
            deadLettered.set(outboxRepository.countDeadLettered(maxAttempts));
        } catch (DataAccessException e) {
            // Gauges keep their last values until the next refresh
            log.warn("Could not refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long backlog() {
        return backlog.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered.total", "event_type", eventType).increment();
    }
}
