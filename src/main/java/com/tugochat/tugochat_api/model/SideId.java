package com.tugochat.tugochat_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed side convention shared by every client:
 * PLAYER1 is the earlier-queued streamer and wins at rope position +100,
 * PLAYER2 wins at -100.
 */
public enum SideId {
    PLAYER1("player1"),
    PLAYER2("player2");

    private final String wireName;

    SideId(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public SideId opponent() {
        return this == PLAYER1 ? PLAYER2 : PLAYER1;
    }
}
