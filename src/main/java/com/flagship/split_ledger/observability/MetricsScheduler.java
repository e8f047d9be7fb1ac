package com.flagship.split_ledger.observability;

import com.flagship.split_ledger.fx.RateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: outbox gauges and expired rate cache entries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final RateCache rateCache;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refresh();
    }

    @Scheduled(fixedRateString = "${split-ledger.fx.cache-eviction-interval-ms:600000}")
    public void evictExpiredRates() {
        int evicted = rateCache.evictExpired();
        log.debug("Rate cache sweep: evicted={}, remaining={}", evicted, rateCache.size());
    }
}
