package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when no exchange rate could be resolved for a draft. The draft was
 * parked and can be re-submitted with {@link ExpenseLedger#retryPending}.
 */
@Getter
public class AwaitingRateException extends RuntimeException {

    private final UUID pendingId;
    private final CurrencyCode from;
    private final CurrencyCode to;

    public AwaitingRateException(UUID pendingId, CurrencyCode from, CurrencyCode to) {
        super(String.format("Expense is awaiting an exchange rate for %s->%s (pending id %s)",
                from, to, pendingId));
        this.pendingId = pendingId;
        this.from = from;
        this.to = to;
    }
}
