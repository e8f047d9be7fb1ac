package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A conversion rate from one currency to another as observed at a point in time.
 *
 * Invariant: a rate between distinct currencies is approximate unless it came
 * straight from the rate source; a rate from a currency to itself is exactly 1.
 */
@Value
public class ExchangeRate {
    CurrencyCode from;
    CurrencyCode to;
    BigDecimal rate;
    Instant observedAt;
    boolean approximate;
    RateLayer layer;

    private ExchangeRate(CurrencyCode from, CurrencyCode to, BigDecimal rate,
                         Instant observedAt, boolean approximate, RateLayer layer) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.rate = Objects.requireNonNull(rate, "rate");
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be positive: " + rate);
        }
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt");
        this.approximate = approximate;
        this.layer = Objects.requireNonNull(layer, "layer");
    }

    public static ExchangeRate identity(CurrencyCode currency, Instant observedAt) {
        return new ExchangeRate(currency, currency, BigDecimal.ONE, observedAt, false, RateLayer.IDENTITY);
    }

    /**
     * Creates a rate resolved by the given layer; the approximate flag follows the layer.
     */
    public static ExchangeRate resolved(CurrencyCode from, CurrencyCode to, BigDecimal rate,
                                        Instant observedAt, RateLayer layer) {
        if (from.equals(to)) {
            throw new IllegalArgumentException("Use identity() for same-currency rates: " + from);
        }
        return new ExchangeRate(from, to, rate, observedAt, layer.isApproximate(), layer);
    }
}
