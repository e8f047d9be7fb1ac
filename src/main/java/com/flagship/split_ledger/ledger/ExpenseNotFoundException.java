package com.flagship.split_ledger.ledger;

/**
 * Thrown when an expense, or a parked draft, does not exist in the given ledger.
 */
public class ExpenseNotFoundException extends RuntimeException {

    private ExpenseNotFoundException(String message) {
        super(message);
    }

    public static ExpenseNotFoundException forExpense(long ledgerId, long expenseId) {
        return new ExpenseNotFoundException(
            String.format("Expense %d not found in ledger %d", expenseId, ledgerId));
    }

    public static ExpenseNotFoundException forPendingDraft(long ledgerId, Object pendingId) {
        return new ExpenseNotFoundException(
            String.format("Pending expense %s not found in ledger %d", pendingId, ledgerId));
    }
}
