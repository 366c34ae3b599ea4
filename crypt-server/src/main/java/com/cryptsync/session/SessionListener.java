package com.cryptsync.session;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.sync.StateDelta;
import com.cryptsync.sync.StateSnapshot;

import java.util.List;

/**
 * Receives everything a game session wants delivered to players.
 *
 * Callbacks are invoked from inside the session's executor, in mutation
 * order. Implementations must only enqueue, never block. Recipient lists are
 * player ids.
 */
public interface SessionListener {

    void playerJoined(String sessionId, List<String> recipients, PlayerSession player);

    /**
     * @param reason one of {@code left}, {@code disconnected}, {@code expired}
     */
    void playerLeft(String sessionId, List<String> recipients, PlayerSession player, String reason);

    void gameStarted(List<String> recipients, StateSnapshot snapshot);

    /**
     * @param originPlayerId player whose request caused the change, or null
     * @param requestId      request id to echo on the originator's copy, or null
     */
    void statePublished(List<String> recipients, StateDelta delta, String originPlayerId, String requestId);

    void snapshotSent(String playerId, StateSnapshot snapshot, String requestId);

    void chatPosted(String sessionId, List<String> recipients, ChatEntry entry);

    void gameEnded(List<String> recipients, StateSnapshot finalSnapshot, String reason);

    /**
     * @param level {@code info} or {@code error}
     */
    void systemNotice(String sessionId, List<String> recipients, String level, String text);

    SessionListener NOOP = new SessionListener() {
        @Override
        public void playerJoined(String sessionId, List<String> recipients, PlayerSession player) {
        }

        @Override
        public void playerLeft(String sessionId, List<String> recipients, PlayerSession player, String reason) {
        }

        @Override
        public void gameStarted(List<String> recipients, StateSnapshot snapshot) {
        }

        @Override
        public void statePublished(List<String> recipients, StateDelta delta, String originPlayerId, String requestId) {
        }

        @Override
        public void snapshotSent(String playerId, StateSnapshot snapshot, String requestId) {
        }

        @Override
        public void chatPosted(String sessionId, List<String> recipients, ChatEntry entry) {
        }

        @Override
        public void gameEnded(List<String> recipients, StateSnapshot finalSnapshot, String reason) {
        }

        @Override
        public void systemNotice(String sessionId, List<String> recipients, String level, String text) {
        }
    };
}
