package com.flagship.split_ledger.fx;

import com.flagship.split_ledger.config.FxProperties;
import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves conversion rates through an ordered chain of layers.
 *
 * Order: identity, cache, direct quote, inverse quote, bridge through the
 * bridge currency, static table. The first layer that answers wins and its
 * answer is cached for the hour bucket of the requested timestamp. Failures
 * and timeouts of the rate source only ever advance the chain; the caller
 * sees {@link RateUnavailableException} once every layer has failed.
 */
@Service
@Slf4j
public class RateResolver {

    private final RateSource rateSource;
    private final RateCache cache;
    private final StaticRateTable staticTable;
    private final ExecutorService executor;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Duration defaultLayerTimeout;
    private final CurrencyCode bridgeCurrency;

    public RateResolver(RateSource rateSource,
                        RateCache cache,
                        StaticRateTable staticTable,
                        @Qualifier("rateLookupExecutor") ExecutorService executor,
                        LedgerMetrics metrics,
                        Clock clock,
                        FxProperties properties) {
        this.rateSource = rateSource;
        this.cache = cache;
        this.staticTable = staticTable;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultLayerTimeout = properties.layerTimeout();
        this.bridgeCurrency = CurrencyCode.of(properties.bridgeCurrency());
    }

    /**
     * Resolves a rate using the configured per-layer timeout.
     *
     * @throws RateUnavailableException if every layer failed
     */
    public ExchangeRate resolve(CurrencyCode from, CurrencyCode to, Instant asOf) {
        return resolve(from, to, asOf, defaultLayerTimeout);
    }

    /**
     * Resolves the rate for one unit of {@code from} in {@code to} as of {@code asOf}.
     *
     * @param layerTimeout upper bound for each rate-source query; a query that
     *                     exceeds it counts as a failure of its layer
     * @throws RateUnavailableException if every layer failed; nothing is cached in that case
     */
    public ExchangeRate resolve(CurrencyCode from, CurrencyCode to, Instant asOf, Duration layerTimeout) {
        if (from.equals(to)) {
            return ExchangeRate.identity(from, asOf);
        }

        Optional<ExchangeRate> cached = cache.get(from, to, asOf);
        if (cached.isPresent()) {
            log.debug("Rate cache hit: pair={}->{}, rate={}, approximate={}",
                    from, to, cached.get().getRate(), cached.get().isApproximate());
            metrics.recordRateResolved(cached.get().getLayer().name(), true);
            return cached.get();
        }

        Optional<ExchangeRate> resolved = direct(from, to, layerTimeout)
                .or(() -> inverse(from, to, layerTimeout))
                .or(() -> bridge(from, to, layerTimeout))
                .or(() -> fromStaticTable(from, to));

        if (resolved.isEmpty()) {
            log.warn("All rate layers failed: pair={}->{}, asOf={}", from, to, asOf);
            metrics.recordRateUnavailable(from.getCode(), to.getCode());
            throw new RateUnavailableException(from, to);
        }

        ExchangeRate rate = resolved.get();
        cache.put(rate, asOf);
        metrics.recordRateResolved(rate.getLayer().name(), false);
        log.debug("Resolved rate: pair={}->{}, rate={}, layer={}, approximate={}",
                from, to, rate.getRate(), rate.getLayer(), rate.isApproximate());
        return rate;
    }

    private Optional<ExchangeRate> direct(CurrencyCode from, CurrencyCode to, Duration timeout) {
        return query(from, to, timeout)
                .map(quote -> ExchangeRate.resolved(from, to, quote, clock.instant(), RateLayer.DIRECT));
    }

    private Optional<ExchangeRate> inverse(CurrencyCode from, CurrencyCode to, Duration timeout) {
        return query(to, from, timeout)
                .map(quote -> BigDecimal.ONE.divide(quote, MathContext.DECIMAL64))
                .map(rate -> ExchangeRate.resolved(from, to, rate, clock.instant(), RateLayer.INVERSE));
    }

    private Optional<ExchangeRate> bridge(CurrencyCode from, CurrencyCode to, Duration timeout) {
        if (from.equals(bridgeCurrency) || to.equals(bridgeCurrency)) {
            // A bridge leg would repeat the direct or inverse query
            return Optional.empty();
        }
        Optional<BigDecimal> firstLeg = query(from, bridgeCurrency, timeout);
        if (firstLeg.isEmpty()) {
            return Optional.empty();
        }
        return query(bridgeCurrency, to, timeout)
                .map(secondLeg -> firstLeg.get().multiply(secondLeg, MathContext.DECIMAL64))
                .map(rate -> ExchangeRate.resolved(from, to, rate, clock.instant(), RateLayer.BRIDGE));
    }

    private Optional<ExchangeRate> fromStaticTable(CurrencyCode from, CurrencyCode to) {
        return staticTable.lookup(from, to)
                .map(rate -> {
                    log.debug("Static rate fallback: pair={}->{}, rate={}, tableVersion={}",
                            from, to, rate, staticTable.version());
                    return ExchangeRate.resolved(from, to, rate, clock.instant(), RateLayer.STATIC);
                });
    }

    /**
     * Queries the rate source with a time budget. Every failure mode collapses to empty.
     */
    private Optional<BigDecimal> query(CurrencyCode from, CurrencyCode to, Duration timeout) {
        try {
            return timedFetch(from, to, timeout);
        } catch (RateSourceTimeoutException e) {
            log.debug(e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> timedFetch(CurrencyCode from, CurrencyCode to, Duration timeout) {
        Future<Optional<BigDecimal>> future = executor.submit(() -> rateSource.fetchRate(from, to));
        try {
            Optional<BigDecimal> quote = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (quote == null) {
                return Optional.empty();
            }
            return quote.filter(value -> value.signum() > 0);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RateSourceTimeoutException(from, to, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Rate source query failed: pair={}->{}, error={}", from, to, cause.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for rate source: pair={}->{}", from, to);
            return Optional.empty();
        }
    }
}
