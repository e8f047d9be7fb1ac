package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds drafts that could not be recorded because no exchange rate was
 * available, so they can be re-submitted later.
 *
 * Drafts are kept for a bounded retention and purged lazily on access.
 */
@Component
@Slf4j
public class PendingExpenseRegistry {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final Map<UUID, PendingExpense> pending = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public PendingExpenseRegistry(Clock clock) {
        this(clock, DEFAULT_RETENTION);
    }

    public PendingExpenseRegistry(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Parks a draft and returns the id under which it can be retried.
     */
    public UUID park(long ledgerId, ExpenseDraft draft, String idempotencyKey,
                     CurrencyCode from, CurrencyCode to) {
        purgeExpired();
        UUID pendingId = UUID.randomUUID();
        pending.put(pendingId, new PendingExpense(pendingId, ledgerId, draft, idempotencyKey,
            from, to, clock.instant()));
        log.info("Parked expense draft awaiting rate {}->{}: pendingId={}, ledgerId={}",
            from, to, pendingId, ledgerId);
        return pendingId;
    }

    public Optional<PendingExpense> find(long ledgerId, UUID pendingId) {
        purgeExpired();
        return Optional.ofNullable(pending.get(pendingId))
            .filter(entry -> entry.getLedgerId() == ledgerId);
    }

    public void remove(UUID pendingId) {
        pending.remove(pendingId);
    }

    public int size() {
        purgeExpired();
        return pending.size();
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        pending.values().removeIf(entry -> !entry.getParkedAt().isAfter(cutoff));
    }

    @Value
    public static class PendingExpense {
        UUID id;
        long ledgerId;
        ExpenseDraft draft;
        String idempotencyKey;
        CurrencyCode from;
        CurrencyCode to;
        Instant parkedAt;
    }
}
