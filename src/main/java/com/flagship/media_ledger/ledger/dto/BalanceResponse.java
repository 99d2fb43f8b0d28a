package com.flagship.media_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balance")
    long balance;
}
