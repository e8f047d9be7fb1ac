package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Getter;

/**
 * Thrown when no resolution layer could produce a rate for a currency pair.
 */
@Getter
public class RateUnavailableException extends RuntimeException {

    private final CurrencyCode from;
    private final CurrencyCode to;

    public RateUnavailableException(CurrencyCode from, CurrencyCode to) {
        super(String.format("No exchange rate available for %s->%s", from, to));
        this.from = from;
        this.to = to;
    }
}
