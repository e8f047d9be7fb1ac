package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.AwaitingRateException;
import lombok.Value;

import java.util.UUID;

/**
 * Body of a 202 response: the expense was not recorded and can be retried
 * under {@code pending_id} once a rate is available.
 */
@Value
public class PendingExpenseResponse {

    @JsonProperty("pending_id")
    UUID pendingId;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("message")
    String message;

    public static PendingExpenseResponse from(AwaitingRateException e) {
        return new PendingExpenseResponse(e.getPendingId(), e.getFrom().getCode(), e.getTo().getCode(), e.getMessage());
    }
}
