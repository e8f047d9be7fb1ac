package com.flagship.split_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A payment from a debtor to a creditor that moves both toward zero.
 */
@Value
public class SettlementTransfer {
    long fromParticipant;
    long toParticipant;
    BigDecimal amount;
}
