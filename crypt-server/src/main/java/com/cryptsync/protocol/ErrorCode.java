package com.cryptsync.protocol;

import java.util.Locale;

/**
 * Reason codes carried in ERROR and AUTH_FAILURE payloads.
 * The wire form is the lower-case constant name, e.g. {@code unknown_action}.
 */
public enum ErrorCode {
    // Protocol
    MALFORMED_MESSAGE,
    UNKNOWN_MESSAGE_TYPE,
    NOT_AUTHENTICATED,
    TIMEOUT,

    // Auth
    INVALID_NAME,
    INVALID_TOKEN,

    // Session
    SESSION_NOT_FOUND,
    SESSION_FULL,
    INVALID_STATE,
    RECONNECT_EXPIRED,
    NOT_IN_SESSION,
    ALREADY_IN_SESSION,

    // Action
    UNKNOWN_ACTION,
    INVALID_PARAMS,
    INVALID_ACTION,
    BUDGET_EXHAUSTED,
    PLAYER_INACTIVE,

    // Sync
    STALE_REVISION,

    INTERNAL_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
