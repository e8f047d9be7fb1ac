package com.flagship.split_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable per-expense copy of the participants' weights, taken when the
 * expense is created. Later changes to a participant's current weight never
 * reach an existing snapshot.
 *
 * Invariants: at least one entry, every weight positive, no participant twice.
 */
@Value
public class WeightSnapshot {
    List<ParticipantShare> shares;

    private WeightSnapshot(List<ParticipantShare> shares) {
        this.shares = shares;
    }

    /**
     * Copies the given shares into a new snapshot.
     *
     * @throws IllegalArgumentException if the list is empty, a weight is not
     *                                  positive or a participant repeats
     */
    public static WeightSnapshot of(List<ParticipantShare> shares) {
        if (shares == null || shares.isEmpty()) {
            throw new IllegalArgumentException("Weight snapshot needs at least one participant");
        }
        Set<Long> seen = new HashSet<>();
        for (ParticipantShare share : shares) {
            if (share.getWeight().signum() <= 0) {
                throw new IllegalArgumentException(
                    "Weight must be positive for participant " + share.getParticipantId());
            }
            if (!seen.add(share.getParticipantId())) {
                throw new IllegalArgumentException(
                    "Participant listed twice: " + share.getParticipantId());
            }
        }
        return new WeightSnapshot(List.copyOf(shares));
    }

    public BigDecimal totalWeight() {
        return shares.stream()
            .map(ParticipantShare::getWeight)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean includes(long participantId) {
        return shares.stream().anyMatch(share -> share.getParticipantId() == participantId);
    }

    public int size() {
        return shares.size();
    }
}
