package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.support.InMemoryExpenseStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.flagship.split_ledger.support.ExpenseFixtures.equalSplit;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis as a fast path in front of the stored idempotency keys, including
 * Redis outages.
 */
@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final long LEDGER_ID = 5L;
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private InMemoryExpenseStore store;
    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryExpenseStore();
        store.addLedger(LEDGER_ID);
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        service = new IdempotencyService(store, Optional.of(redisTemplate));
    }

    private Expense stored(String key) {
        long id = store.appendExpense(equalSplit(LEDGER_ID, 1L, "10", NOW, 1L, 2L), key);
        return store.findById(LEDGER_ID, id).orElseThrow();
    }

    @Test
    @DisplayName("Should resolve a cached key through Redis")
    void shouldUseRedisHit() {
        Expense expense = stored(null);
        when(valueOperations.get("split-ledger:idempotency:k1")).thenReturn(LEDGER_ID + ":" + expense.getId());

        Optional<Expense> found = service.findPrevious("k1");

        assertEquals(expense.getId(), found.orElseThrow().getId());
    }

    @Test
    @DisplayName("Should fall back to the database when Redis is down")
    void shouldFallBackWhenRedisDown() {
        Expense expense = stored("k2");
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("Connection refused"));
        doThrow(new RedisConnectionFailureException("Connection refused"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        Optional<Expense> found = service.findPrevious("k2");

        assertEquals(expense.getId(), found.orElseThrow().getId());
    }

    @Test
    @DisplayName("Should backfill Redis after a database hit")
    void shouldBackfillRedis() {
        Expense expense = stored("k3");
        when(valueOperations.get(anyString())).thenReturn(null);

        service.findPrevious("k3");

        verify(valueOperations).set("split-ledger:idempotency:k3", LEDGER_ID + ":" + expense.getId(),
            Duration.ofDays(7));
    }

    @Test
    @DisplayName("Should ignore a malformed cache entry")
    void shouldIgnoreMalformedEntry() {
        when(valueOperations.get(anyString())).thenReturn("not-a-pair");

        assertTrue(service.findPrevious("k4").isEmpty());
    }

    @Test
    @DisplayName("Should refuse to cache an unsaved expense")
    void shouldRejectUnsavedExpense() {
        Expense unsaved = equalSplit(LEDGER_ID, 1L, "10", NOW, 1L, 2L);

        assertThrows(IllegalArgumentException.class, () -> service.remember("k5", unsaved));
        assertThrows(IllegalArgumentException.class, () -> service.findPrevious(" "));
    }
}
