package com.tugochat.tugochat_api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Streamer identity as resolved by the identity provider at login.
 *
 * The core never mutates a Player. {@code viewerCount} is read once per match
 * as the audience size of that side.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Player(String id, String username, String profileImage, int viewerCount) {

    /** A player needs a stable id, a display name and a non-negative audience. */
    public boolean isValid() {
        return id != null && !id.isBlank()
                && username != null && !username.isBlank()
                && viewerCount >= 0;
    }
}
