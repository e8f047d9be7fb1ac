package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.fx.ExchangeRate;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A recorded expense.
 *
 * Amount, currency, rate and weight snapshot are fixed when the expense is
 * created. The only permitted change is the transition to VOID; an edit is
 * a void followed by a new expense.
 */
@Value
public class Expense {
    Long id;                      // null until persisted
    long ledgerId;
    long payerId;
    BigDecimal originalAmount;
    CurrencyCode originalCurrency;
    BigDecimal amountInBase;
    CurrencyCode baseCurrency;
    BigDecimal fxRate;
    boolean fxApproximate;
    String category;
    String description;
    Instant occurredAt;
    WeightSnapshot weightSnapshot;
    ExpenseStatus status;
    Instant createdAt;

    /**
     * Creates an APPROVED expense from a draft and the rate resolved for it.
     * The base amount is the exact product {@code originalAmount * rate}.
     *
     * @throws IllegalArgumentException if the rate does not convert the draft's
     *                                  currency into the base currency
     */
    public static Expense create(long ledgerId,
                                 ExpenseDraft draft,
                                 CurrencyCode baseCurrency,
                                 ExchangeRate rate,
                                 String category,
                                 Instant createdAt) {
        if (!rate.getFrom().equals(draft.getCurrency()) || !rate.getTo().equals(baseCurrency)) {
            throw new IllegalArgumentException(String.format(
                "Rate %s->%s does not convert %s into base currency %s",
                rate.getFrom(), rate.getTo(), draft.getCurrency(), baseCurrency));
        }
        return new Expense(
            null,
            ledgerId,
            draft.getPayerId(),
            draft.getAmount(),
            draft.getCurrency(),
            draft.getAmount().multiply(rate.getRate()),
            baseCurrency,
            rate.getRate(),
            rate.isApproximate(),
            category,
            draft.getDescription(),
            draft.getAsOf(),
            draft.snapshot(),
            ExpenseStatus.APPROVED,
            createdAt
        );
    }

    /**
     * Returns a copy carrying the id assigned by the store.
     */
    public Expense withId(long assignedId) {
        return new Expense(assignedId, ledgerId, payerId, originalAmount, originalCurrency,
            amountInBase, baseCurrency, fxRate, fxApproximate, category, description,
            occurredAt, weightSnapshot, status, createdAt);
    }

    /**
     * Transitions to VOID. Voiding a void expense returns it unchanged.
     */
    public Expense markVoid() {
        if (status == ExpenseStatus.VOID) {
            return this;
        }
        return new Expense(id, ledgerId, payerId, originalAmount, originalCurrency,
            amountInBase, baseCurrency, fxRate, fxApproximate, category, description,
            occurredAt, weightSnapshot, ExpenseStatus.VOID, createdAt);
    }

    public boolean isApproved() {
        return status == ExpenseStatus.APPROVED;
    }
}
