package com.flagship.split_ledger.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CategoryTotal {
    String category;
    BigDecimal totalInBase;
}
