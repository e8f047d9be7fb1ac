package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.Ledger;
import lombok.Value;

import java.time.Instant;

@Value
public class LedgerResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerResponse from(Ledger ledger) {
        return new LedgerResponse(ledger.getId(), ledger.getBaseCurrency().getCode(), ledger.getCreatedAt());
    }
}
