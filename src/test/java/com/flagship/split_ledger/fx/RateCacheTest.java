package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RateCacheTest {

    private static final CurrencyCode USD = CurrencyCode.USD;
    private static final CurrencyCode ILS = CurrencyCode.of("ILS");
    private static final Instant T0 = Instant.parse("2024-06-01T10:15:00Z");

    private MutableClock clock;
    private RateCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new RateCache(clock, Duration.ofHours(6));
    }

    private ExchangeRate usdIls(String rate) {
        return ExchangeRate.resolved(USD, ILS, new BigDecimal(rate), clock.instant(), RateLayer.DIRECT);
    }

    @Test
    @DisplayName("Should floor timestamps to the start of their hour")
    void shouldComputeHourBucket() {
        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), RateCache.hourBucket(T0));
        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), RateCache.hourBucket(Instant.parse("2024-06-01T10:59:59.999Z")));
    }

    @Test
    @DisplayName("Should serve any timestamp in the same hour bucket")
    void shouldHitWithinSameBucket() {
        cache.put(usdIls("3.71"), T0);

        assertTrue(cache.get(USD, ILS, Instant.parse("2024-06-01T10:00:00Z")).isPresent());
        assertTrue(cache.get(USD, ILS, Instant.parse("2024-06-01T10:59:00Z")).isPresent());
        assertTrue(cache.get(USD, ILS, Instant.parse("2024-06-01T11:00:00Z")).isEmpty());
        assertTrue(cache.get(ILS, USD, T0).isEmpty(), "Reverse pair is a different key");
    }

    @Test
    @DisplayName("Should expire entries six hours after they were written")
    void shouldExpireAfterTtl() {
        cache.put(usdIls("3.71"), T0);

        clock.advance(Duration.ofHours(6).minusSeconds(1));
        assertTrue(cache.get(USD, ILS, T0).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(USD, ILS, T0).isEmpty());
        assertEquals(0, cache.size(), "Expired entry is dropped on read");
    }

    @Test
    @DisplayName("Should let the last writer win for the same key")
    void shouldOverwriteSameKey() {
        cache.put(usdIls("3.70"), T0);
        cache.put(usdIls("3.72"), T0.plusSeconds(60));

        assertEquals(0, new BigDecimal("3.72").compareTo(cache.get(USD, ILS, T0).orElseThrow().getRate()));
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Should evict only expired entries in a sweep")
    void shouldEvictExpired() {
        cache.put(usdIls("3.70"), T0);
        clock.advance(Duration.ofHours(3));
        cache.put(usdIls("3.75"), T0.plus(Duration.ofHours(3)));
        clock.advance(Duration.ofHours(4));

        assertEquals(1, cache.evictExpired());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Should reject a non-positive TTL")
    void shouldRejectInvalidTtl() {
        assertThrows(IllegalArgumentException.class, () -> new RateCache(clock, Duration.ZERO));
    }
}
