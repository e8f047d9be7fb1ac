package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated input for recording an expense.
 *
 * A draft that exists is well-formed: positive amount, payer and currency
 * present, at least one participant, every weight positive, no participant
 * listed twice. The participant list is copied, so later changes to the
 * caller's list never reach the draft.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseDraft {
    long payerId;
    BigDecimal amount;
    CurrencyCode currency;
    List<ParticipantShare> participants;
    String category;
    String description;
    Instant asOf;

    /**
     * Builds a draft after checking every precondition.
     *
     * @throws InvalidExpenseException if any precondition is violated
     */
    public static ExpenseDraft of(Long payerId,
                                  BigDecimal amount,
                                  CurrencyCode currency,
                                  List<ParticipantShare> participants,
                                  String category,
                                  String description,
                                  Instant asOf) {
        if (payerId == null) {
            throw new InvalidExpenseException("Payer is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidExpenseException("Expense amount must be positive");
        }
        if (currency == null) {
            throw new InvalidExpenseException("Currency is required");
        }
        if (asOf == null) {
            throw new InvalidExpenseException("Expense timestamp is required");
        }
        if (participants == null || participants.isEmpty()) {
            throw new InvalidExpenseException("At least one participant is required");
        }

        Set<Long> seen = new HashSet<>();
        for (ParticipantShare share : participants) {
            if (share == null) {
                throw new InvalidExpenseException("Participant entry cannot be null");
            }
            if (share.getWeight().signum() <= 0) {
                throw new InvalidExpenseException(
                    "Weight must be positive for participant " + share.getParticipantId());
            }
            if (!seen.add(share.getParticipantId())) {
                throw new InvalidExpenseException(
                    "Duplicate participant: " + share.getParticipantId());
            }
        }

        return new ExpenseDraft(payerId, amount, currency, List.copyOf(participants),
            category, description, asOf);
    }

    /**
     * The payer followed by every participant, each once.
     */
    public Set<Long> involvedParticipantIds() {
        Set<Long> ids = new LinkedHashSet<>();
        ids.add(payerId);
        participants.forEach(share -> ids.add(share.getParticipantId()));
        return ids;
    }

    public WeightSnapshot snapshot() {
        return WeightSnapshot.of(participants);
    }
}
