package com.flagship.split_ledger.ledger;

/**
 * Lifecycle of a recorded expense.
 */
public enum ExpenseStatus {
    /**
     * Recorded with a fixed rate and weight snapshot. Counts toward balances.
     */
    APPROVED,

    /**
     * Soft-deleted. Kept for audit, excluded from balances and settlements.
     * Terminal.
     */
    VOID
}
