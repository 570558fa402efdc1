package com.tugochat.tugochat_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EndReason {
    ROPE_REACHED_BOUNDARY,
    TIME_EXPIRED,
    OPPONENT_DISCONNECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
