package com.flagship.split_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.Participant;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ParticipantResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("weight")
    BigDecimal weight;

    @JsonProperty("virtual")
    boolean virtual;

    public static ParticipantResponse from(Participant participant) {
        return new ParticipantResponse(participant.getId(), participant.getName(),
            participant.getWeight(), participant.isVirtual());
    }
}
