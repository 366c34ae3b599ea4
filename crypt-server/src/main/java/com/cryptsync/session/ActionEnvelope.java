package com.cryptsync.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * An applied action, numbered in the order the session executed it.
 */
public final class ActionEnvelope {

    private final long sequence;
    private final String playerId;
    private final String actionType;
    private final JsonNode params;
    private final Instant timestamp;
    private final String requestId;

    public ActionEnvelope(long sequence, String playerId, String actionType, JsonNode params,
                          Instant timestamp, String requestId) {
        this.sequence = sequence;
        this.playerId = playerId;
        this.actionType = actionType;
        this.params = params == null ? null : params.deepCopy();
        this.timestamp = timestamp;
        this.requestId = requestId;
    }

    public long getSequence() {
        return sequence;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getActionType() {
        return actionType;
    }

    public JsonNode getParams() {
        return params;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "ActionEnvelope{#" + sequence + " " + playerId + " " + actionType + " " + params + '}';
    }
}
