package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.ProtocolException;
import com.cryptsync.session.GameSession;
import com.cryptsync.session.SessionException;
import com.cryptsync.session.SessionManager;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * CREATE_GAME, JOIN_GAME, LEAVE_GAME, LIST_GAMES, READY and RECONNECT.
 */
public class GameLobbyHandler {

    private final SessionManager sessionManager;

    public GameLobbyHandler(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public CompletableFuture<?> handleCreate(Connection connection, Message message) {
        JsonNode maxPlayers = message.getPayload() == null ? null : message.getPayload().get("max_players");
        Integer seats = null;
        if (maxPlayers != null && !maxPlayers.isNull()) {
            if (!maxPlayers.isIntegralNumber() || !maxPlayers.canConvertToInt() || maxPlayers.intValue() < 1) {
                throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "'max_players' must be a positive integer");
            }
            seats = maxPlayers.intValue();
        }
        return sessionManager.createGame(connection.getPlayer(), message.payloadText("name"), seats)
                .thenAccept(result -> connection.send(Messages.gameCreated(result, message.getRequestId())));
    }

    public CompletableFuture<?> handleJoin(Connection connection, Message message) {
        String sessionId = requireSessionId(message);
        return sessionManager.joinGame(sessionId, connection.getPlayer())
                .thenAccept(result -> connection.send(Messages.gameJoined(result, message.getRequestId())));
    }

    public CompletableFuture<?> handleLeave(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        String sessionId = player.getGameSessionId();
        return sessionManager.leaveGame(player)
                .thenRun(() -> connection.send(Messages.playerLeft(sessionId, player, "left", message.getRequestId())));
    }

    public CompletableFuture<?> handleList(Connection connection, Message message) {
        connection.send(Messages.gameList(sessionManager.listGames(), message.getRequestId()));
        return null;
    }

    public CompletableFuture<?> handleReady(Connection connection, Message message) {
        PlayerSession player = connection.getPlayer();
        GameSession session = sessionManager.findSession(player);
        if (session == null) {
            throw new SessionException(ErrorCode.NOT_IN_SESSION, "Not in a game");
        }
        JsonNode ready = message.getPayload() == null ? null : message.getPayload().get("ready");
        if (ready != null && !ready.isBoolean()) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "'ready' must be a boolean");
        }
        return session.setReady(player.getPlayerId(), ready == null || ready.booleanValue());
    }

    public CompletableFuture<?> handleReconnect(Connection connection, Message message) {
        String sessionId = message.payloadText("session_id");
        if (sessionId == null) {
            sessionId = connection.getPlayer().getGameSessionId();
        }
        if (sessionId == null) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "'session_id' is required");
        }
        return sessionManager.reconnect(connection.getPlayer(), sessionId, message.getRequestId())
                .thenAccept(result -> connection.send(Messages.gameJoined(result, message.getRequestId())));
    }

    private static String requireSessionId(Message message) {
        String sessionId = message.payloadText("session_id");
        if (sessionId == null || sessionId.isBlank()) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "'session_id' is required");
        }
        return sessionId;
    }
}
