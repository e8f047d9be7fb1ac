package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through cache of resolved exchange rates.
 *
 * Entries are keyed by currency pair and the hour bucket of the requested
 * timestamp, and expire a fixed time after they were written (measured on
 * the injected clock). Concurrent writers for the same key simply overwrite
 * each other: within one hour bucket the values are interchangeable.
 */
@Slf4j
public class RateCache {

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public RateCache(Clock clock, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Floors a timestamp to the start of its hour.
     */
    public static Instant hourBucket(Instant asOf) {
        return asOf.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * Returns the cached rate for the pair in the hour bucket of {@code asOf},
     * if one was written less than the TTL ago.
     */
    public Optional<ExchangeRate> get(CurrencyCode from, CurrencyCode to, Instant asOf) {
        Key key = new Key(from, to, hourBucket(asOf));
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.getRate());
    }

    /**
     * Stores a resolved rate under the hour bucket of {@code asOf}.
     */
    public void put(ExchangeRate rate, Instant asOf) {
        Key key = new Key(rate.getFrom(), rate.getTo(), hourBucket(asOf));
        entries.put(key, new Entry(rate, clock.instant()));
    }

    /**
     * Drops expired entries.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        int before = entries.size();
        entries.values().removeIf(this::isExpired);
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Evicted {} expired rate cache entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private boolean isExpired(Entry entry) {
        return !clock.instant().isBefore(entry.getCreatedAt().plus(ttl));
    }

    @Value
    private static class Key {
        CurrencyCode from;
        CurrencyCode to;
        Instant hourBucket;
    }

    @Value
    private static class Entry {
        ExchangeRate rate;
        Instant createdAt;
    }
}
