package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.config.FxProperties;
import com.flagship.split_ledger.currency.CurrencyCode;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last-resort table of approximate mid-market rates for common pairs.
 *
 * The built-in table can be replaced wholesale through configuration
 * without touching the remote rate source. Only the listed direction is
 * served; a missing reverse pair is not derived.
 */
public class StaticRateTable {

    public static final String BUILT_IN_VERSION = "2024-06";

    private static final Map<String, BigDecimal> BUILT_IN_RATES = Map.of(
        "USD_ILS", new BigDecimal("3.70"),
        "EUR_ILS", new BigDecimal("4.00"),
        "GBP_ILS", new BigDecimal("4.70"),
        "USD_EUR", new BigDecimal("0.92"),
        "EUR_USD", new BigDecimal("1.09")
    );

    private final String version;
    private final Map<String, BigDecimal> rates;

    public StaticRateTable(String version, Map<String, BigDecimal> rates) {
        Map<String, BigDecimal> validated = new HashMap<>();
        rates.forEach((pair, rate) -> {
            if (!pair.matches("^[A-Z]{3}_[A-Z]{3}$")) {
                throw new IllegalArgumentException("Static rate key must look like USD_ILS: " + pair);
            }
            if (rate == null || rate.signum() <= 0) {
                throw new IllegalArgumentException("Static rate for " + pair + " must be positive");
            }
            validated.put(pair, rate);
        });
        this.version = version;
        this.rates = Map.copyOf(validated);
    }

    public static StaticRateTable builtIn() {
        return new StaticRateTable(BUILT_IN_VERSION, BUILT_IN_RATES);
    }

    /**
     * Builds the table from configuration, falling back to the built-in rates
     * when no override is configured.
     */
    public static StaticRateTable from(FxProperties.StaticTable config) {
        if (config == null || config.rates().isEmpty()) {
            return builtIn();
        }
        String version = config.version() != null ? config.version() : "custom";
        return new StaticRateTable(version, config.rates());
    }

    public Optional<BigDecimal> lookup(CurrencyCode from, CurrencyCode to) {
        return Optional.ofNullable(rates.get(from.getCode() + "_" + to.getCode()));
    }

    public String version() {
        return version;
    }

    public int size() {
        return rates.size();
    }
}
