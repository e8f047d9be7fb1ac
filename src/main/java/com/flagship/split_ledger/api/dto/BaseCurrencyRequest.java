package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of the ensure-ledger and change-currency calls. Accepts any token the
 * currency registry recognizes ("ILS", "nis", "₪", ...).
 */
@Value
public class BaseCurrencyRequest {

    @NotBlank(message = "Base currency is required")
    @JsonProperty("base_currency")
    String baseCurrency;
}
