package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * Adds a member. Without a user id the participant is virtual and gets the
 * next negative id of the ledger.
 */
@Value
public class AddParticipantRequest {

    @Positive(message = "User id must be positive")
    @JsonProperty("user_id")
    Long userId;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;
}
