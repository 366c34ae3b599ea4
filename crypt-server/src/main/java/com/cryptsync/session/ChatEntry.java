package com.cryptsync.session;

/**
 * One line of a session's chat log.
 */
public final class ChatEntry {

    private final String playerId;
    private final String displayName;
    private final String text;
    private final long timestamp;

    public ChatEntry(String playerId, String displayName, String text, long timestamp) {
        this.playerId = playerId;
        this.displayName = displayName;
        this.text = text;
        this.timestamp = timestamp;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getText() {
        return text;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return displayName + ": " + text;
    }
}
