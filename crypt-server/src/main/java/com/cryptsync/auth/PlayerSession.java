package com.cryptsync.auth;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An authenticated player identity.
 *
 * Created on AUTH and kept across dropped connections, so that a player can
 * come back with the same token. The owning game session is held by id only;
 * the session manager resolves it.
 *
 * Thread Safety:
 * - Identity fields are immutable after creation
 * - Game membership uses AtomicReference, presence fields are volatile.
 *   Presence is written only from the owning game session's executor.
 */
public class PlayerSession {

    private final String token;
    private final String playerId;
    private final String displayName;
    private final Instant issuedAt;

    private final AtomicReference<String> gameSessionId;
    private volatile boolean connected;
    private volatile Instant disconnectDeadline;

    public PlayerSession(String token, String playerId, String displayName, Instant issuedAt) {
        this.token = token;
        this.playerId = playerId;
        this.displayName = displayName;
        this.issuedAt = issuedAt;
        this.gameSessionId = new AtomicReference<>(null);
        this.connected = true;
    }

    public String getToken() {
        return token;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public String getGameSessionId() {
        return gameSessionId.get();
    }

    public void setGameSessionId(String sessionId) {
        gameSessionId.set(sessionId);
    }

    /**
     * Binds this player to a game session unless already bound to another one.
     *
     * @return true if the player is now bound to {@code sessionId}
     */
    public boolean bindGameSession(String sessionId) {
        return gameSessionId.compareAndSet(null, sessionId) || sessionId.equals(gameSessionId.get());
    }

    /**
     * Clears the game membership only if it still points at {@code sessionId}.
     */
    public boolean clearGameSessionId(String sessionId) {
        return gameSessionId.compareAndSet(sessionId, null);
    }

    public boolean isInGame() {
        return gameSessionId.get() != null;
    }

    public boolean isConnected() {
        return connected;
    }

    public Instant getDisconnectDeadline() {
        return disconnectDeadline;
    }

    /**
     * Marks the player as gone until {@code deadline}.
     */
    public void markDisconnected(Instant deadline) {
        this.connected = false;
        this.disconnectDeadline = deadline;
    }

    public void markConnected() {
        this.connected = true;
        this.disconnectDeadline = null;
    }

    /**
     * True if the player is disconnected and the deadline has passed.
     */
    public boolean isDeadlineExpired(Instant now) {
        Instant deadline = disconnectDeadline;
        return !connected && deadline != null && now.isAfter(deadline);
    }

    @Override
    public String toString() {
        return "PlayerSession{" +
                "playerId='" + playerId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", gameSessionId='" + gameSessionId.get() + '\'' +
                ", connected=" + connected +
                '}';
    }
}
