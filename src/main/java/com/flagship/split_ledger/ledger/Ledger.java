package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.Value;

import java.time.Instant;

/**
 * A shared-expense ledger. The id is supplied by the caller (usually the id
 * of the group conversation the ledger belongs to).
 */
@Value
public class Ledger {
    long id;
    CurrencyCode baseCurrency;
    Instant createdAt;
}
