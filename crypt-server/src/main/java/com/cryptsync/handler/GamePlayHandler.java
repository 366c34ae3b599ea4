package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.ProtocolException;
import com.cryptsync.protocol.action.ActionException;
import com.cryptsync.session.GameSession;
import com.cryptsync.session.SessionException;
import com.cryptsync.session.SessionManager;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * ACTION, PASS, CHAT and RESYNC.
 *
 * Successful actions are answered by the delta broadcast itself, whose copy
 * for the sender echoes the request_id.
 */
public class GamePlayHandler {

    private final SessionManager sessionManager;

    public GamePlayHandler(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public CompletableFuture<?> handleAction(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        GameSession session = requireSession(player);
        String actionType = message.payloadText("action_type");
        if (actionType == null || actionType.isBlank()) {
            throw new ActionException(ErrorCode.INVALID_PARAMS, "'action_type' is required");
        }
        JsonNode params = message.getPayload().get("params");
        return session.submitAction(player.getPlayerId(), actionType, params, message.getRequestId());
    }

    public CompletableFuture<?> handlePass(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        return requireSession(player).pass(player.getPlayerId(), message.getRequestId());
    }

    public CompletableFuture<?> handleChat(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        String text = message.payloadText("text");
        if (text == null) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "'text' is required");
        }
        return requireSession(player).chat(player.getPlayerId(), text);
    }

    /**
     * Answers with a full STATE. Also works after the game ended, when the
     * player is no longer bound to the session, if the payload names it.
     */
    public CompletableFuture<?> handleResync(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        GameSession session = sessionManager.findSession(player);
        String sessionId = message.payloadText("session_id");
        if (session == null && sessionId != null) {
            session = sessionManager.getSession(sessionId);
        }
        if (session == null) {
            throw new SessionException(ErrorCode.NOT_IN_SESSION, "Not in a game");
        }
        return session.requestSnapshot(player.getPlayerId(), message.getRequestId());
    }

    private GameSession requireSession(PlayerSession player) {
        GameSession session = sessionManager.findSession(player);
        if (session == null) {
            throw new SessionException(ErrorCode.NOT_IN_SESSION, "Not in a game");
        }
        return session;
    }
}
