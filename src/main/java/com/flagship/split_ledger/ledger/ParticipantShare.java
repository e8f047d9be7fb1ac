package com.flagship.split_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One participant's weight in a single expense.
 */
@Value
public class ParticipantShare {
    long participantId;
    BigDecimal weight;

    @JsonCreator
    private ParticipantShare(@JsonProperty("participantId") long participantId,
                             @JsonProperty("weight") BigDecimal weight) {
        this.participantId = participantId;
        this.weight = Objects.requireNonNull(weight, "weight");
    }

    public static ParticipantShare of(long participantId, BigDecimal weight) {
        return new ParticipantShare(participantId, weight);
    }

    public static ParticipantShare equal(long participantId) {
        return new ParticipantShare(participantId, BigDecimal.ONE);
    }
}
