package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.currency.CurrencyCode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * External source of direct exchange-rate quotes.
 *
 * Implementations may be slow or unavailable and may throw; the resolver
 * treats any exception, timeout or empty answer as a failed lookup.
 */
@FunctionalInterface
public interface RateSource {

    /**
     * Fetches the current quote for one unit of {@code from} expressed in {@code to}.
     *
     * @return the quote, or empty if the source has none for this pair
     */
    Optional<BigDecimal> fetchRate(CurrencyCode from, CurrencyCode to);
}
