package com.flagship.split_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps client idempotency keys to the expense they created.
 *
 * Redis answers repeat submissions quickly; the {@code idempotency_key}
 * column of the expenses table is the source of truth and is consulted
 * whenever Redis misses or is unreachable.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "split-ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ExpenseStore expenseStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(ExpenseStore expenseStore, Optional<StringRedisTemplate> redisTemplate) {
        this.expenseStore = expenseStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Returns the expense previously created with this key, if any.
     */
    public Optional<Expense> findPrevious(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<Expense> cached = readRedis(idempotencyKey).flatMap(this::loadCached);
        if (cached.isPresent()) {
            log.debug("Idempotency key resolved from Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<Expense> stored = expenseStore.findByIdempotencyKey(idempotencyKey);
        stored.ifPresent(expense -> {
            log.debug("Idempotency key resolved from database: {}", idempotencyKey);
            remember(idempotencyKey, expense);
        });
        return stored;
    }

    /**
     * Caches the key in Redis. The database row written with the expense
     * already holds the key, so a Redis failure is only logged.
     */
    public void remember(String idempotencyKey, Expense expense) {
        requireKey(idempotencyKey);
        if (expense.getId() == null) {
            throw new IllegalArgumentException("Expense must be persisted before its key is cached");
        }
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(KEY_PREFIX + idempotencyKey,
                    expense.getLedgerId() + ":" + expense.getId(), REDIS_TTL);
            } catch (DataAccessException e) {
                log.warn("Could not cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private Optional<String> readRedis(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(KEY_PREFIX + idempotencyKey));
        } catch (DataAccessException e) {
            log.warn("Redis lookup failed for idempotency key {}, using database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Cached values look like {@code ledgerId:expenseId}.
     */
    private Optional<Expense> loadCached(String value) {
        String[] parts = value.split(":", 2);
        if (parts.length != 2) {
            log.warn("Ignoring malformed idempotency cache entry: {}", value);
            return Optional.empty();
        }
        try {
            return expenseStore.findById(Long.parseLong(parts[0]), Long.parseLong(parts[1]));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed idempotency cache entry: {}", value);
            return Optional.empty();
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
    }
}
