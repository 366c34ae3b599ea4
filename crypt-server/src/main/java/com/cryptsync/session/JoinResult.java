package com.cryptsync.session;

import com.cryptsync.sync.StateSnapshot;

import java.util.Collections;
import java.util.List;

/**
 * Reply to a join, create or reconnect request.
 */
public final class JoinResult {

    private final SessionInfo session;
    private final StateSnapshot snapshot;
    private final List<ChatEntry> chatHistory;
    private final boolean rejoined;

    public JoinResult(SessionInfo session, StateSnapshot snapshot, List<ChatEntry> chatHistory, boolean rejoined) {
        this.session = session;
        this.snapshot = snapshot;
        this.chatHistory = Collections.unmodifiableList(chatHistory);
        this.rejoined = rejoined;
    }

    public SessionInfo getSession() {
        return session;
    }

    /**
     * Current state when rejoining a running game, otherwise null.
     */
    public StateSnapshot getSnapshot() {
        return snapshot;
    }

    public List<ChatEntry> getChatHistory() {
        return chatHistory;
    }

    /**
     * True when the player resumed an existing roster slot.
     */
    public boolean isRejoined() {
        return rejoined;
    }
}
