package com.flagship.split_ledger.report;

import com.flagship.split_ledger.balance.BalanceCalculator;
import com.flagship.split_ledger.balance.TimeWindow;
import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ExpenseStore;
import com.flagship.split_ledger.ledger.LedgerService;
import com.flagship.split_ledger.ledger.Participant;
import com.flagship.split_ledger.ledger.ParticipantService;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.SettlementPlanner;
import com.flagship.split_ledger.settlement.SettlementTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-side views of a ledger: balances, settlement plan and category totals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReportService {

    private final LedgerService ledgerService;
    private final ParticipantService participantService;
    private final ExpenseStore expenseStore;
    private final BalanceCalculator balanceCalculator;
    private final SettlementPlanner settlementPlanner;
    private final LedgerMetrics metrics;

    /**
     * @param window                 null for the whole history
     * @param includeAllParticipants list every member, including those without activity
     */
    @Transactional(readOnly = true)
    public SortedMap<Long, BigDecimal> balances(long ledgerId, TimeWindow window, boolean includeAllParticipants) {
        ledgerService.getLedger(ledgerId);
        List<Expense> expenses = expenseStore.loadApprovedExpenses(ledgerId, window);
        List<Long> included = includeAllParticipants
            ? participantService.list(ledgerId).stream().map(Participant::getId).toList()
            : List.of();

        SortedMap<Long, BigDecimal> balances =
            balanceCalculator.computeBalances(expenses, Optional.ofNullable(window), included);
        if (!BalanceCalculator.isBalanced(balances)) {
            // Rounding cannot explain this; an inconsistent expense was stored
            log.error("Ledger {} balances do not sum to zero: total={}, expenses={}",
                ledgerId, BalanceCalculator.total(balances), expenses.size());
        }
        return balances;
    }

    @Transactional(readOnly = true)
    public List<SettlementTransfer> settlement(long ledgerId, TimeWindow window) {
        SortedMap<Long, BigDecimal> balances = balances(ledgerId, window, false);
        List<SettlementTransfer> transfers = metrics.timeSettlement(() -> settlementPlanner.planSettlement(balances));
        log.debug("Settlement for ledger {}: {} transfers among {} participants",
            ledgerId, transfers.size(), balances.size());
        return transfers;
    }

    /**
     * Sum of base amounts per category, largest first.
     */
    @Transactional(readOnly = true)
    public List<CategoryTotal> categoryTotals(long ledgerId, TimeWindow window) {
        ledgerService.getLedger(ledgerId);
        Map<String, BigDecimal> totals = new TreeMap<>();
        for (Expense expense : expenseStore.loadApprovedExpenses(ledgerId, window)) {
            totals.merge(expense.getCategory(), expense.getAmountInBase(), BigDecimal::add);
        }
        return totals.entrySet().stream()
            .map(entry -> new CategoryTotal(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparing(CategoryTotal::getTotalInBase).reversed()
                .thenComparing(CategoryTotal::getCategory))
            .toList();
    }
}
