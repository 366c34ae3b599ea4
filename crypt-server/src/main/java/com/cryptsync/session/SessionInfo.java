package com.cryptsync.session;

import java.util.Collections;
import java.util.List;

/**
 * Immutable summary of a game session, used for listings and join replies.
 */
public final class SessionInfo {

    private final String sessionId;
    private final String name;
    private final String ownerId;
    private final SessionStatus status;
    private final List<String> players;
    private final int maxPlayers;
    private final long createdAt;

    public SessionInfo(String sessionId, String name, String ownerId, SessionStatus status,
                       List<String> players, int maxPlayers, long createdAt) {
        this.sessionId = sessionId;
        this.name = name;
        this.ownerId = ownerId;
        this.status = status;
        this.players = Collections.unmodifiableList(players);
        this.maxPlayers = maxPlayers;
        this.createdAt = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getName() {
        return name;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    /**
     * Display names in join order.
     */
    public List<String> getPlayers() {
        return players;
    }

    public int getPlayerCount() {
        return players.size();
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public boolean isJoinable() {
        return status == SessionStatus.LOBBY && players.size() < maxPlayers;
    }

    @Override
    public String toString() {
        return "SessionInfo{" + sessionId + " '" + name + "' " + status + " " + players.size() + "/" + maxPlayers + '}';
    }
}
