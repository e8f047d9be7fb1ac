package com.flagship.split_ledger.settlement;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Turns balances into a short list of transfers.
 *
 * Greedy: the largest creditor and the largest debtor are paired repeatedly,
 * the smaller side is settled in full and any remainder goes back into its
 * queue. Equal amounts are ordered by ascending participant id, so the plan
 * is reproducible. Balances within {@link #EPSILON} of zero are treated as
 * settled. At most {@code n - 1} transfers are produced for {@code n}
 * participants with a nonzero balance.
 */
@Component
public class SettlementPlanner {

    public static final BigDecimal EPSILON = new BigDecimal("1e-6");

    private static final Comparator<Position> LARGEST_FIRST =
        Comparator.comparing(Position::getAmount).reversed()
            .thenComparingLong(Position::getParticipantId);

    /**
     * Plans transfers that bring every balance to zero within {@link #EPSILON}.
     * The input map is not modified.
     */
    public List<SettlementTransfer> planSettlement(Map<Long, BigDecimal> balances) {
        PriorityQueue<Position> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Position> debtors = new PriorityQueue<>(LARGEST_FIRST);

        balances.forEach((participantId, balance) -> {
            if (balance.compareTo(EPSILON) > 0) {
                creditors.add(new Position(participantId, balance));
            } else if (balance.compareTo(EPSILON.negate()) < 0) {
                debtors.add(new Position(participantId, balance.negate()));
            }
        });

        List<SettlementTransfer> transfers = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Position creditor = creditors.poll();
            Position debtor = debtors.poll();
            BigDecimal amount = creditor.getAmount().min(debtor.getAmount());
            transfers.add(new SettlementTransfer(debtor.getParticipantId(), creditor.getParticipantId(), amount));

            BigDecimal creditLeft = creditor.getAmount().subtract(amount);
            if (creditLeft.compareTo(EPSILON) > 0) {
                creditors.add(new Position(creditor.getParticipantId(), creditLeft));
            }
            BigDecimal debtLeft = debtor.getAmount().subtract(amount);
            if (debtLeft.compareTo(EPSILON) > 0) {
                debtors.add(new Position(debtor.getParticipantId(), debtLeft));
            }
        }
        return List.copyOf(transfers);
    }

    /**
     * Outstanding magnitude for one side of the book.
     */
    @Value
    private static class Position {
        long participantId;
        BigDecimal amount;
    }
}
