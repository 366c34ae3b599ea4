package com.cryptsync.session;

/**
 * Lifecycle of a game session. Transitions only move forward.
 */
public enum SessionStatus {
    LOBBY,
    ACTIVE,
    ENDED
}
