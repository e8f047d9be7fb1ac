package com.flagship.split_ledger.ledger.event;

import com.flagship.split_ledger.ledger.Expense;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an expense transitions to VOID.
 */
@Value
public class ExpenseVoidedEvent implements LedgerEvent {
    UUID eventId;
    long ledgerId;
    long expenseId;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseVoided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseVoidedEvent fromExpense(Expense expense, Instant occurredAt) {
        return new ExpenseVoidedEvent(
            UUID.randomUUID(),
            expense.getLedgerId(),
            expense.getId(),
            expense.getStatus().name(),
            occurredAt
        );
    }
}
