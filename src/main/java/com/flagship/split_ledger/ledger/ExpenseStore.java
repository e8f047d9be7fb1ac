package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.balance.TimeWindow;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for expenses and their weight snapshots.
 *
 * Mutating calls are expected to run inside the caller's transaction, after
 * {@link #lockForAppend(long)} has serialized access to the ledger.
 */
public interface ExpenseStore {

    /**
     * Locks the ledger row until the surrounding transaction ends.
     *
     * @throws IllegalArgumentException if the ledger does not exist
     */
    void lockForAppend(long ledgerId);

    /**
     * Persists an APPROVED expense together with its snapshot.
     *
     * @param idempotencyKey optional client key, unique across all expenses
     * @return the id assigned to the expense
     */
    long appendExpense(Expense expense, String idempotencyKey);

    /**
     * Sets the status of an expense to VOID.
     *
     * @return true if a row changed
     */
    boolean markVoid(long ledgerId, long expenseId);

    Optional<Expense> findById(long ledgerId, long expenseId);

    Optional<Expense> findByIdempotencyKey(String idempotencyKey);

    /**
     * APPROVED expenses whose timestamp falls in the window, oldest first.
     */
    List<Expense> loadApprovedExpenses(long ledgerId, TimeWindow window);

    /**
     * Every expense of the ledger, VOID included, oldest first.
     */
    List<Expense> listExpenses(long ledgerId);

    long countExpenses(long ledgerId);
}
