package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Value
public class BalancesResponse {

    @JsonProperty("ledger_id")
    long ledgerId;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("balances")
    List<Entry> balances;

    @Value
    public static class Entry {
        @JsonProperty("participant_id")
        long participantId;

        @JsonProperty("balance")
        BigDecimal balance;
    }

    public static BalancesResponse of(long ledgerId, String baseCurrency, Map<Long, BigDecimal> balances) {
        return new BalancesResponse(ledgerId, baseCurrency, balances.entrySet().stream()
            .map(entry -> new Entry(entry.getKey(), entry.getValue()))
            .toList());
    }
}
