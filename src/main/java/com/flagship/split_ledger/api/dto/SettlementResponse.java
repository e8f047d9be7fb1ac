package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.SettlementTransfer;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SettlementResponse {

    @JsonProperty("ledger_id")
    long ledgerId;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("transfers")
    List<Transfer> transfers;

    @Value
    public static class Transfer {
        @JsonProperty("from")
        long from;

        @JsonProperty("to")
        long to;

        @JsonProperty("amount")
        BigDecimal amount;
    }

    public static SettlementResponse of(long ledgerId, String baseCurrency, List<SettlementTransfer> transfers) {
        return new SettlementResponse(ledgerId, baseCurrency, transfers.stream()
            .map(t -> new Transfer(t.getFromParticipant(), t.getToParticipant(), t.getAmount()))
            .toList());
    }
}
