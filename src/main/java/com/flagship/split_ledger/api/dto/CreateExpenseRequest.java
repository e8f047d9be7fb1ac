package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Request to record an expense.
 *
 * The currency may be an ISO code or a recognized alias. A participant entry
 * without a weight takes the participant's current weight. A missing
 * timestamp means now.
 */
@Value
public class CreateExpenseRequest {

    @NotNull(message = "Payer is required")
    @JsonProperty("payer_id")
    Long payerId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    String currency;

    @NotEmpty(message = "At least one participant is required")
    @Valid
    @JsonProperty("participants")
    List<ParticipantEntry> participants;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("timestamp")
    Instant timestamp;

    @Value
    public static class ParticipantEntry {

        @NotNull(message = "Participant id is required")
        @JsonProperty("participant_id")
        Long participantId;

        @JsonProperty("weight")
        BigDecimal weight;
    }
}
