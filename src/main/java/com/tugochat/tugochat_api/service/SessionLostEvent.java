package com.tugochat.tugochat_api.service;

/**
 * Published when a push to a session fails, so the session can be routed
 * through the disconnect path.
 */
public record SessionLostEvent(String sessionId) {
}
