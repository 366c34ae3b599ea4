package com.cryptsync.protocol;

import java.util.Locale;

/**
 * Defines all message types for the game protocol.
 *
 * Client → Server:
 * - AUTH: Authenticate with a display name, or resume an identity with a token
 * - CREATE_GAME / JOIN_GAME / LEAVE_GAME / LIST_GAMES: Lobby management
 * - READY: Toggle readiness in the lobby
 * - ACTION: Spend one action of the current round
 * - PASS: Give up the rest of this round
 * - CHAT: Send a chat line to the session
 * - RECONNECT: Re-bind to a session after a dropped connection
 * - RESYNC: Request a full state snapshot after a revision gap
 *
 * Server → Client:
 * - AUTH_SUCCESS / AUTH_FAILURE: Authentication result
 * - GAME_CREATED / GAME_JOINED / GAME_LIST: Lobby replies
 * - STATE: Complete state snapshot
 * - DELTA: Incremental state changes against a base revision
 * - PLAYER_JOINED / PLAYER_LEFT: Roster notifications
 * - GAME_START / GAME_END: Lifecycle notifications
 * - CHAT_MESSAGE, SYSTEM: Informational, may be dropped for slow clients
 * - ERROR: Error notification
 */
public enum MessageType {
    // Client → Server
    AUTH(false),
    CREATE_GAME(false),
    JOIN_GAME(false),
    LEAVE_GAME(false),
    LIST_GAMES(false),
    READY(false),
    ACTION(false),
    PASS(false),
    CHAT(false),
    RECONNECT(false),
    RESYNC(false),

    // Server → Client
    AUTH_SUCCESS(false),
    AUTH_FAILURE(false),
    GAME_CREATED(false),
    GAME_JOINED(false),
    GAME_LIST(false),
    STATE(false),
    DELTA(false),
    PLAYER_JOINED(false),
    PLAYER_LEFT(false),
    GAME_START(false),
    GAME_END(false),
    CHAT_MESSAGE(true),
    SYSTEM(true),
    ERROR(false);

    private final boolean droppable;

    MessageType(boolean droppable) {
        this.droppable = droppable;
    }

    /**
     * Whether a congested connection may discard this message.
     * State-bearing messages are never droppable.
     */
    public boolean isDroppable() {
        return droppable;
    }

    /**
     * Resolves a wire type name, case-insensitively.
     *
     * @return the type, or null if the name is unknown
     */
    public static MessageType fromWire(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
