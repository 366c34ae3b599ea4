package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.protocol.MessageType;
import com.cryptsync.session.ChatEntry;
import com.cryptsync.session.JoinResult;
import com.cryptsync.session.SessionInfo;
import com.cryptsync.sync.StateDelta;
import com.cryptsync.sync.StateSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Builders for every server-to-client message.
 */
public final class Messages {

    private static final MessageSerializer SERIALIZER = new MessageSerializer();

    private Messages() {
    }

    public static Message authSuccess(PlayerSession player, String requestId) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("player_id", player.getPlayerId());
        payload.put("token", player.getToken());
        payload.put("display_name", player.getDisplayName());
        if (player.getGameSessionId() != null) {
            payload.put("session_id", player.getGameSessionId());
        }
        return reply(MessageType.AUTH_SUCCESS, payload, requestId);
    }

    public static Message authFailure(ErrorCode code, String text, String requestId) {
        return reply(MessageType.AUTH_FAILURE, reason(code, text), requestId);
    }

    public static Message error(ErrorCode code, String text, String requestId) {
        return reply(MessageType.ERROR, reason(code, text), requestId);
    }

    public static Message gameCreated(JoinResult result, String requestId) {
        return reply(MessageType.GAME_CREATED, joinPayload(result), requestId);
    }

    public static Message gameJoined(JoinResult result, String requestId) {
        return reply(MessageType.GAME_JOINED, joinPayload(result), requestId);
    }

    public static Message gameList(List<SessionInfo> games, String requestId) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.set("games", SERIALIZER.toTree(games));
        return reply(MessageType.GAME_LIST, payload, requestId);
    }

    public static Message state(StateSnapshot snapshot, String requestId) {
        return reply(MessageType.STATE, SERIALIZER.toTree(snapshot), requestId);
    }

    public static Message delta(StateDelta delta, String requestId) {
        return reply(MessageType.DELTA, SERIALIZER.toTree(delta), requestId);
    }

    public static Message playerJoined(String sessionId, PlayerSession player) {
        return reply(MessageType.PLAYER_JOINED, playerPayload(sessionId, player), null);
    }

    public static Message playerLeft(String sessionId, PlayerSession player, String reason, String requestId) {
        ObjectNode payload = playerPayload(sessionId, player);
        payload.put("reason", reason);
        return reply(MessageType.PLAYER_LEFT, payload, requestId);
    }

    public static Message gameStart(StateSnapshot snapshot) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("session_id", snapshot.getSessionId());
        payload.put("revision", snapshot.getRevision());
        payload.put("max_actions", snapshot.getMaxActions());
        payload.put("players", snapshot.getPlayers().size());
        return reply(MessageType.GAME_START, payload, null);
    }

    public static Message gameEnd(StateSnapshot finalSnapshot, String reason) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("session_id", finalSnapshot.getSessionId());
        payload.put("reason", reason);
        if (finalSnapshot.getVictory() != null) {
            payload.put("victory", finalSnapshot.getVictory());
        }
        payload.set("snapshot", SERIALIZER.toTree(finalSnapshot));
        return reply(MessageType.GAME_END, payload, null);
    }

    public static Message chat(String sessionId, ChatEntry entry) {
        ObjectNode payload = (ObjectNode) SERIALIZER.toTree(entry);
        payload.put("session_id", sessionId);
        return reply(MessageType.CHAT_MESSAGE, payload, null);
    }

    public static Message system(String level, String text) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("level", level);
        payload.put("text", text);
        return reply(MessageType.SYSTEM, payload, null);
    }

    private static ObjectNode reason(ErrorCode code, String text) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("reason", code.wireName());
        if (text != null) {
            payload.put("message", text);
        }
        return payload;
    }

    private static ObjectNode joinPayload(JoinResult result) {
        ObjectNode payload = (ObjectNode) SERIALIZER.toTree(result.getSession());
        payload.put("rejoined", result.isRejoined());
        ArrayNode chat = payload.putArray("chat_history");
        for (ChatEntry entry : result.getChatHistory()) {
            chat.add(SERIALIZER.toTree(entry));
        }
        return payload;
    }

    private static ObjectNode playerPayload(String sessionId, PlayerSession player) {
        ObjectNode payload = SERIALIZER.createObjectNode();
        payload.put("session_id", sessionId);
        payload.put("player_id", player.getPlayerId());
        payload.put("display_name", player.getDisplayName());
        return payload;
    }

    private static Message reply(MessageType type, JsonNode payload, String requestId) {
        return Message.builder()
                .type(type)
                .payload(payload)
                .requestId(requestId)
                .build();
    }
}
