package com.flagship.split_ledger.support;

import com.flagship.split_ledger.balance.TimeWindow;
import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ExpenseStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed expense store for service tests that do not need PostgreSQL.
 */
public class InMemoryExpenseStore implements ExpenseStore {

    private final Map<Long, Expense> expenses = new HashMap<>();
    private final Map<String, Long> idempotencyKeys = new HashMap<>();
    private final Set<Long> ledgers = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();
    private int lockCount;

    public void addLedger(long ledgerId) {
        ledgers.add(ledgerId);
    }

    public int lockCount() {
        return lockCount;
    }

    @Override
    public synchronized void lockForAppend(long ledgerId) {
        if (!ledgers.contains(ledgerId)) {
            throw new IllegalArgumentException("Ledger not found: " + ledgerId);
        }
        lockCount++;
    }

    @Override
    public synchronized long appendExpense(Expense expense, String idempotencyKey) {
        if (idempotencyKey != null && idempotencyKeys.containsKey(idempotencyKey)) {
            throw new IllegalStateException("Duplicate idempotency key " + idempotencyKey);
        }
        long id = sequence.incrementAndGet();
        expenses.put(id, expense.withId(id));
        if (idempotencyKey != null) {
            idempotencyKeys.put(idempotencyKey, id);
        }
        return id;
    }

    @Override
    public synchronized boolean markVoid(long ledgerId, long expenseId) {
        Expense expense = expenses.get(expenseId);
        if (expense == null || expense.getLedgerId() != ledgerId || !expense.isApproved()) {
            return false;
        }
        expenses.put(expenseId, expense.markVoid());
        return true;
    }

    @Override
    public synchronized Optional<Expense> findById(long ledgerId, long expenseId) {
        return Optional.ofNullable(expenses.get(expenseId))
            .filter(expense -> expense.getLedgerId() == ledgerId);
    }

    @Override
    public synchronized Optional<Expense> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(idempotencyKeys.get(idempotencyKey)).map(expenses::get);
    }

    @Override
    public synchronized List<Expense> loadApprovedExpenses(long ledgerId, TimeWindow window) {
        return listExpenses(ledgerId).stream()
            .filter(Expense::isApproved)
            .filter(expense -> window == null || window.contains(expense.getOccurredAt()))
            .toList();
    }

    @Override
    public synchronized List<Expense> listExpenses(long ledgerId) {
        List<Expense> result = new ArrayList<>();
        for (Expense expense : expenses.values()) {
            if (expense.getLedgerId() == ledgerId) {
                result.add(expense);
            }
        }
        result.sort(Comparator.comparing(Expense::getOccurredAt).thenComparing(Expense::getId));
        return result;
    }

    @Override
    public synchronized long countExpenses(long ledgerId) {
        return listExpenses(ledgerId).size();
    }
}
