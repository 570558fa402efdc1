package com.tugochat.tugochat_api.model;

import java.time.Instant;

/** One accepted chat pull command from a viewer. */
public record PullEvent(String viewerId, Instant at) {
}
