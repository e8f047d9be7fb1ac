package com.flagship.split_ledger.fx;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.split_ledger.config.FxProperties;
import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Rate source backed by a Frankfurter-style HTTP API:
 * {@code GET {base-url}/latest?from=USD&to=ILS} answering
 * {@code {"base":"USD","rates":{"ILS":3.71}}}.
 *
 * Transport errors and non-2xx responses propagate as exceptions; the
 * resolver turns them into a failed layer.
 */
@Component
@ConditionalOnProperty(name = "split-ledger.fx.source", havingValue = "http", matchIfMissing = true)
@Slf4j
public class HttpRateSource implements RateSource {

    private final RestClient restClient;

    public HttpRateSource(RestClient.Builder builder, FxProperties properties) {
        this.restClient = builder
                .baseUrl(properties.baseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, "SplitLedger/1.0")
                .build();
    }

    @Override
    public Optional<BigDecimal> fetchRate(CurrencyCode from, CurrencyCode to) {
        JsonNode body = restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/latest")
                        .queryParam("from", from.getCode())
                        .queryParam("to", to.getCode())
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);

        if (body == null) {
            return Optional.empty();
        }
        JsonNode rate = body.path("rates").path(to.getCode());
        if (!rate.isNumber()) {
            log.debug("Rate API returned no quote: pair={}->{}", from, to);
            return Optional.empty();
        }
        return Optional.of(rate.decimalValue());
    }
}
