package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.Message;
import com.cryptsync.session.ChatEntry;
import com.cryptsync.session.SessionListener;
import com.cryptsync.sync.StateDelta;
import com.cryptsync.sync.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns session events into wire messages and queues them on the players'
 * connections.
 *
 * Runs on session executors. Queuing never blocks, and frames go out on each
 * connection's own event loop.
 */
public class SessionBroadcaster implements SessionListener {

    private static final Logger logger = LoggerFactory.getLogger(SessionBroadcaster.class);

    private final ConnectionRegistry registry;

    public SessionBroadcaster(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void playerJoined(String sessionId, List<String> recipients, PlayerSession player) {
        registry.broadcast(recipients, Messages.playerJoined(sessionId, player));
    }

    @Override
    public void playerLeft(String sessionId, List<String> recipients, PlayerSession player, String reason) {
        registry.broadcast(recipients, Messages.playerLeft(sessionId, player, reason, null));
    }

    @Override
    public void gameStarted(List<String> recipients, StateSnapshot snapshot) {
        registry.broadcast(recipients, Messages.gameStart(snapshot));
        registry.broadcast(recipients, Messages.state(snapshot, null));
    }

    @Override
    public void statePublished(List<String> recipients, StateDelta delta, String originPlayerId, String requestId) {
        logger.debug("Broadcasting revision {} of game {} to {} players",
                delta.getNewRevision(), delta.getSessionId(), recipients.size());
        if (originPlayerId == null || requestId == null || !recipients.contains(originPlayerId)) {
            registry.broadcast(recipients, Messages.delta(delta, null));
            return;
        }
        List<String> others = new ArrayList<>(recipients);
        others.remove(originPlayerId);
        registry.sendTo(originPlayerId, Messages.delta(delta, requestId));
        registry.broadcast(others, Messages.delta(delta, null));
    }

    @Override
    public void snapshotSent(String playerId, StateSnapshot snapshot, String requestId) {
        registry.sendTo(playerId, Messages.state(snapshot, requestId));
    }

    @Override
    public void chatPosted(String sessionId, List<String> recipients, ChatEntry entry) {
        registry.broadcast(recipients, Messages.chat(sessionId, entry));
    }

    @Override
    public void gameEnded(List<String> recipients, StateSnapshot finalSnapshot, String reason) {
        registry.broadcast(recipients, Messages.gameEnd(finalSnapshot, reason));
    }

    @Override
    public void systemNotice(String sessionId, List<String> recipients, String level, String text) {
        Message notice = Messages.system(level, text);
        registry.broadcast(recipients, notice);
    }
}
