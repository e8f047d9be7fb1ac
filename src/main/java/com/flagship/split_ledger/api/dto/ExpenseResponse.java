package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ExpenseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("ledger_id")
    long ledgerId;

    @JsonProperty("payer_id")
    long payerId;

    @JsonProperty("original_amount")
    BigDecimal originalAmount;

    @JsonProperty("original_currency")
    String originalCurrency;

    @JsonProperty("amount_in_base")
    BigDecimal amountInBase;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("fx_rate")
    BigDecimal fxRate;

    @JsonProperty("fx_approximate")
    boolean fxApproximate;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("participants")
    List<Share> participants;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class Share {
        @JsonProperty("participant_id")
        long participantId;

        @JsonProperty("weight")
        BigDecimal weight;
    }

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .ledgerId(expense.getLedgerId())
            .payerId(expense.getPayerId())
            .originalAmount(expense.getOriginalAmount())
            .originalCurrency(expense.getOriginalCurrency().getCode())
            .amountInBase(expense.getAmountInBase())
            .baseCurrency(expense.getBaseCurrency().getCode())
            .fxRate(expense.getFxRate())
            .fxApproximate(expense.isFxApproximate())
            .category(expense.getCategory())
            .description(expense.getDescription())
            .timestamp(expense.getOccurredAt())
            .status(expense.getStatus())
            .participants(expense.getWeightSnapshot().getShares().stream()
                .map(share -> new Share(share.getParticipantId(), share.getWeight()))
                .toList())
            .createdAt(expense.getCreatedAt())
            .build();
    }
}
