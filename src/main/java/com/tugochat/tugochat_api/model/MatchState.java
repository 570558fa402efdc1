package com.tugochat.tugochat_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

// PENDING_READY → IN_PROGRESS → ENDED
public enum MatchState {
    PENDING_READY,
    IN_PROGRESS,
    ENDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
