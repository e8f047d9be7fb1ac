package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class SetWeightRequest {

    @NotNull(message = "Weight is required")
    @DecimalMin(value = "0", inclusive = false, message = "Weight must be greater than 0")
    @JsonProperty("weight")
    BigDecimal weight;
}
