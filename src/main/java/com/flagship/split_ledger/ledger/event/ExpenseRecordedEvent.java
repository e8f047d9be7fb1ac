package com.flagship.split_ledger.ledger.event;

import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ParticipantShare;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when an expense is recorded. Carries the full durable record,
 * weight snapshot included.
 */
@Value
public class ExpenseRecordedEvent implements LedgerEvent {
    UUID eventId;
    long ledgerId;
    long expenseId;
    long payerId;
    BigDecimal originalAmount;
    String originalCurrency;
    BigDecimal amountInBase;
    String baseCurrency;
    BigDecimal fxRate;
    boolean fxApproximate;
    String category;
    String description;
    Instant expenseTimestamp;
    List<ParticipantShare> weightSnapshot;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseRecordedEvent fromExpense(Expense expense, Instant occurredAt) {
        return new ExpenseRecordedEvent(
            UUID.randomUUID(),
            expense.getLedgerId(),
            expense.getId(),
            expense.getPayerId(),
            expense.getOriginalAmount(),
            expense.getOriginalCurrency().getCode(),
            expense.getAmountInBase(),
            expense.getBaseCurrency().getCode(),
            expense.getFxRate(),
            expense.isFxApproximate(),
            expense.getCategory(),
            expense.getDescription(),
            expense.getOccurredAt(),
            expense.getWeightSnapshot().getShares(),
            occurredAt
        );
    }
}
