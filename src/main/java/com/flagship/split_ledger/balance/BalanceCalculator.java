package com.flagship.split_ledger.balance;

import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ParticipantShare;
import com.flagship.split_ledger.ledger.WeightSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Net balance per participant, in the ledger's base currency.
 *
 * The payer of an expense is credited its base amount; every participant in
 * the expense's weight snapshot is debited {@code amountInBase * weight / totalWeight}.
 * A positive balance means the participant is owed money.
 *
 * Stateless: balances are derived from the expenses alone, using the weights
 * stored with each expense.
 */
@Component
public class BalanceCalculator {

    public static final BigDecimal EPSILON = new BigDecimal("1e-6");

    /** Decimal places kept on a single participant's debit. */
    static final int SHARE_SCALE = 12;

    public SortedMap<Long, BigDecimal> computeBalances(List<Expense> expenses, Optional<TimeWindow> window) {
        return computeBalances(expenses, window, List.of());
    }

    /**
     * @param includeParticipants participants that appear in the result with a
     *                            zero balance even without activity in scope
     * @return balances keyed by participant id in ascending order
     */
    public SortedMap<Long, BigDecimal> computeBalances(List<Expense> expenses,
                                                       Optional<TimeWindow> window,
                                                       Collection<Long> includeParticipants) {
        SortedMap<Long, BigDecimal> balances = new TreeMap<>();
        for (Long participantId : includeParticipants) {
            balances.put(participantId, BigDecimal.ZERO);
        }

        for (Expense expense : expenses) {
            if (!expense.isApproved()) {
                continue;
            }
            if (window.isPresent() && !window.get().contains(expense.getOccurredAt())) {
                continue;
            }
            balances.merge(expense.getPayerId(), expense.getAmountInBase(), BigDecimal::add);
            shareOf(expense).forEach((participantId, debit) ->
                balances.merge(participantId, debit.negate(), BigDecimal::add));
        }
        return balances;
    }

    /**
     * The amount each snapshot participant owes for one expense. Debits are
     * rounded to {@link #SHARE_SCALE} places and the last snapshot entry takes
     * the rounding remainder, so the values sum to exactly the base amount.
     */
    public Map<Long, BigDecimal> shareOf(Expense expense) {
        WeightSnapshot snapshot = expense.getWeightSnapshot();
        BigDecimal amount = expense.getAmountInBase();
        BigDecimal totalWeight = snapshot.totalWeight();
        List<ParticipantShare> entries = snapshot.getShares();

        Map<Long, BigDecimal> shares = new LinkedHashMap<>();
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < entries.size() - 1; i++) {
            ParticipantShare share = entries.get(i);
            BigDecimal debit = amount.multiply(share.getWeight())
                .divide(totalWeight, SHARE_SCALE, RoundingMode.HALF_EVEN);
            allocated = allocated.add(debit);
            shares.put(share.getParticipantId(), plain(debit));
        }
        ParticipantShare last = entries.get(entries.size() - 1);
        shares.put(last.getParticipantId(), plain(amount.subtract(allocated)));
        return Collections.unmodifiableMap(shares);
    }

    private static BigDecimal plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /**
     * Sum of all balances; zero within {@link #EPSILON} for a consistent ledger.
     */
    public static BigDecimal total(Map<Long, BigDecimal> balances) {
        return balances.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static boolean isBalanced(Map<Long, BigDecimal> balances) {
        return total(balances).abs().compareTo(EPSILON) <= 0;
    }
}
