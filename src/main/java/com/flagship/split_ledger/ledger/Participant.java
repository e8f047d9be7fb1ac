package com.flagship.split_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A member of a ledger.
 *
 * Real users carry their positive external id. Virtual participants (people
 * without an account) take ids from the reserved negative range -1, -2, ...
 * allocated per ledger.
 */
@Value
public class Participant {
    long ledgerId;
    long id;
    String name;
    BigDecimal weight;

    public boolean isVirtual() {
        return id < 0;
    }

    /**
     * Share for a new expense, using the current weight.
     */
    public ParticipantShare currentShare() {
        return ParticipantShare.of(id, weight);
    }
}
