package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.report.CategoryTotal;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CategoryTotalResponse {

    @JsonProperty("category")
    String category;

    @JsonProperty("total_in_base")
    BigDecimal totalInBase;

    public static CategoryTotalResponse from(CategoryTotal total) {
        return new CategoryTotalResponse(total.getCategory(), total.getTotalInBase());
    }
}
