package com.flagship.split_ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Rate resolution settings, bound from {@code split-ledger.fx.*}.
 *
 * @param source      {@code http} to query the remote rate API, {@code offline} to rely on the static table only
 * @param baseUrl     base URL of the remote rate API
 * @param layerTimeout upper bound for a single rate-source query
 * @param cacheTtl    how long a resolved rate stays valid after it was cached
 * @param bridgeCurrency intermediate currency for bridged conversions
 * @param staticTable versioned table of approximate fallback rates
 */
@ConfigurationProperties(prefix = "split-ledger.fx")
public record FxProperties(
    String source,
    String baseUrl,
    Duration layerTimeout,
    Duration cacheTtl,
    String bridgeCurrency,
    StaticTable staticTable
) {

    public static final Duration DEFAULT_LAYER_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(6);

    public FxProperties {
        if (source == null || source.isBlank()) {
            source = "http";
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.frankfurter.app";
        }
        if (layerTimeout == null) {
            layerTimeout = DEFAULT_LAYER_TIMEOUT;
        }
        if (cacheTtl == null) {
            cacheTtl = DEFAULT_CACHE_TTL;
        }
        if (bridgeCurrency == null || bridgeCurrency.isBlank()) {
            bridgeCurrency = "USD";
        }
        if (staticTable == null) {
            staticTable = new StaticTable(null, null);
        }
    }

    /**
     * Fallback rates keyed {@code FROM_TO}, e.g. {@code USD_ILS: 3.70}.
     * An empty map means the built-in table is used.
     */
    public record StaticTable(String version, Map<String, BigDecimal> rates) {

        public StaticTable {
            rates = rates == null ? Map.of() : Map.copyOf(rates);
        }
    }

    public static FxProperties defaults() {
        return new FxProperties(null, null, null, null, null, null);
    }
}
