package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.config.FxProperties;
import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rate resolution through every fallback layer, against a scripted rate source.
 */
class RateResolverTest {

    private static final CurrencyCode USD = CurrencyCode.USD;
    private static final CurrencyCode ILS = CurrencyCode.of("ILS");
    private static final CurrencyCode EUR = CurrencyCode.of("EUR");
    private static final CurrencyCode JPY = CurrencyCode.of("JPY");
    private static final CurrencyCode GBP = CurrencyCode.of("GBP");
    private static final Instant AS_OF = Instant.parse("2024-06-01T10:15:00Z");

    private final Map<String, BigDecimal> quotes = new HashMap<>();
    private final List<String> queried = Collections.synchronizedList(new ArrayList<>());

    private MutableClock clock;
    private RateCache cache;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private RateResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(AS_OF);
        cache = new RateCache(clock, Duration.ofHours(6));
        executor = Executors.newFixedThreadPool(2);
        meterRegistry = new SimpleMeterRegistry();
        resolver = resolverWith((from, to) -> {
            queried.add(from + "->" + to);
            return Optional.ofNullable(quotes.get(from + "->" + to));
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RateResolver resolverWith(RateSource source) {
        FxProperties properties = new FxProperties("offline", null, Duration.ofMillis(300), null, null, null);
        return new RateResolver(source, cache, StaticRateTable.builtIn(), executor,
            new LedgerMetrics(meterRegistry), clock, properties);
    }

    private static void assertRate(String expected, ExchangeRate rate) {
        assertEquals(0, new BigDecimal(expected).compareTo(rate.getRate()),
            "expected " + expected + " but was " + rate.getRate());
    }

    @Test
    @DisplayName("Should return exactly 1 for a currency to itself without touching source or cache")
    void shouldResolveIdentity() {
        ExchangeRate rate = resolver.resolve(ILS, ILS, AS_OF);

        assertRate("1", rate);
        assertFalse(rate.isApproximate());
        assertEquals(RateLayer.IDENTITY, rate.getLayer());
        assertTrue(queried.isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should use a direct quote as an exact rate and cache it")
    void shouldUseDirectQuote() {
        quotes.put("USD->ILS", new BigDecimal("3.71"));

        ExchangeRate rate = resolver.resolve(USD, ILS, AS_OF);

        assertRate("3.71", rate);
        assertFalse(rate.isApproximate());
        assertEquals(RateLayer.DIRECT, rate.getLayer());
        assertEquals(1, cache.size());

        // Second call within the hour bucket is served from the cache
        queried.clear();
        ExchangeRate cached = resolver.resolve(USD, ILS, AS_OF.plusSeconds(600));
        assertRate("3.71", cached);
        assertTrue(queried.isEmpty());
        assertEquals(1.0, meterRegistry.counter("ledger.rates.resolved", "layer", "DIRECT", "cache", "hit").count());
    }

    @Test
    @DisplayName("Should invert the reverse quote when the direct one is missing")
    void shouldFallBackToInverse() {
        quotes.put("ILS->USD", new BigDecimal("0.25"));

        ExchangeRate rate = resolver.resolve(USD, ILS, AS_OF);

        assertRate("4", rate);
        assertTrue(rate.isApproximate());
        assertEquals(RateLayer.INVERSE, rate.getLayer());
        assertEquals(List.of("USD->ILS", "ILS->USD"), queried);
    }

    @Test
    @DisplayName("Should bridge through USD when direct and inverse quotes are missing")
    void shouldFallBackToBridge() {
        quotes.put("EUR->USD", new BigDecimal("1.10"));
        quotes.put("USD->JPY", new BigDecimal("150"));

        ExchangeRate rate = resolver.resolve(EUR, JPY, AS_OF);

        assertRate("165", rate);
        assertTrue(rate.isApproximate());
        assertEquals(RateLayer.BRIDGE, rate.getLayer());
    }

    @Test
    @DisplayName("Should move past the bridge when one leg fails")
    void shouldSkipBridgeWhenLegFails() {
        quotes.put("EUR->USD", new BigDecimal("1.10"));

        assertThrows(RateUnavailableException.class, () -> resolver.resolve(EUR, JPY, AS_OF));
    }

    @Test
    @DisplayName("Should not bridge when either side is the bridge currency")
    void shouldSkipBridgeForUsdPairs() {
        assertThrows(RateUnavailableException.class, () -> resolver.resolve(GBP, USD, AS_OF));
        assertEquals(List.of("GBP->USD", "USD->GBP"), queried);
    }

    @Test
    @DisplayName("Should use the static table when the source has nothing")
    void shouldFallBackToStaticTable() {
        ExchangeRate rate = resolver.resolve(USD, ILS, AS_OF);

        assertRate("3.70", rate);
        assertTrue(rate.isApproximate());
        assertEquals(RateLayer.STATIC, rate.getLayer());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Should fail and cache nothing when every layer fails")
    void shouldFailWhenAllLayersFail() {
        RateUnavailableException e = assertThrows(RateUnavailableException.class,
            () -> resolver.resolve(JPY, ILS, AS_OF));

        assertEquals(JPY, e.getFrom());
        assertEquals(ILS, e.getTo());
        assertEquals(0, cache.size());
        assertEquals(1.0, meterRegistry.counter("ledger.rates.unavailable", "pair", "JPY_ILS").count());
    }

    @Test
    @DisplayName("Should treat a source exception as a failed layer")
    void shouldSwallowSourceExceptions() {
        RateResolver failing = resolverWith((from, to) -> {
            throw new IllegalStateException("rate API returned 503");
        });

        ExchangeRate rate = failing.resolve(EUR, ILS, AS_OF);

        assertRate("4.00", rate);
        assertEquals(RateLayer.STATIC, rate.getLayer());
    }

    @Test
    @DisplayName("Should treat non-positive quotes as a failed layer")
    void shouldIgnoreNonPositiveQuotes() {
        quotes.put("USD->ILS", BigDecimal.ZERO);
        quotes.put("ILS->USD", new BigDecimal("-1"));

        ExchangeRate rate = resolver.resolve(USD, ILS, AS_OF);

        assertEquals(RateLayer.STATIC, rate.getLayer());
    }

    @Test
    @DisplayName("Should abandon a slow query after the layer timeout and try the next layer")
    void shouldFallThroughOnTimeout() {
        RateResolver slowDirect = resolverWith((from, to) -> {
            if (from.equals(USD)) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.of(new BigDecimal("3.71"));
            }
            return Optional.of(new BigDecimal("0.25"));
        });

        long start = System.nanoTime();
        ExchangeRate rate = slowDirect.resolve(USD, ILS, AS_OF, Duration.ofMillis(100));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(RateLayer.INVERSE, rate.getLayer());
        assertRate("4", rate);
        assertTrue(elapsedMs < 2_000, "took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("Should query again once the cached entry has expired")
    void shouldRefreshAfterExpiry() {
        quotes.put("USD->EUR", new BigDecimal("0.93"));
        resolver.resolve(USD, EUR, AS_OF);

        clock.advance(Duration.ofHours(6));
        quotes.put("USD->EUR", new BigDecimal("0.95"));
        ExchangeRate refreshed = resolver.resolve(USD, EUR, AS_OF);

        assertRate("0.95", refreshed);
    }

    @Test
    @DisplayName("Should cache per hour bucket of the requested timestamp")
    void shouldKeyCacheByHourBucket() {
        quotes.put("USD->EUR", new BigDecimal("0.93"));
        resolver.resolve(USD, EUR, AS_OF);

        queried.clear();
        resolver.resolve(USD, EUR, AS_OF.plus(Duration.ofHours(1)));

        assertEquals(List.of("USD->EUR"), queried);
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Should keep full precision when inverting")
    void shouldInvertWithDecimal64() {
        quotes.put("ILS->USD", new BigDecimal("0.27"));

        ExchangeRate rate = resolver.resolve(USD, ILS, AS_OF);

        assertEquals(BigDecimal.ONE.divide(new BigDecimal("0.27"), MathContext.DECIMAL64), rate.getRate());
    }
}
