package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;

import java.time.Duration;

/**
 * A single rate-source query exceeded its time budget.
 * Only ever raised and caught inside {@link RateResolver}.
 */
class RateSourceTimeoutException extends RuntimeException {

    RateSourceTimeoutException(CurrencyCode from, CurrencyCode to, Duration timeout) {
        super(String.format("Rate source query %s->%s timed out after %dms", from, to, timeout.toMillis()));
    }
}
