package com.cryptsync.sync;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Full, immutable state of a game session at one revision.
 *
 * Snapshots are built on the session's executor and then only ever read, so
 * they are safe to hand to the gateway for encoding on any thread.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StateSnapshot {

    private final String sessionId;
    private final long revision;
    private final String status;
    private final long roundNumber;
    private final int actionsTaken;
    private final int maxActions;
    private final boolean gameOver;
    private final Boolean victory;
    private final Map<String, EntityState> entities;
    private final Map<String, EntityState> players;

    private StateSnapshot(Builder builder) {
        this.sessionId = builder.sessionId;
        this.revision = builder.revision;
        this.status = builder.status;
        this.roundNumber = builder.roundNumber;
        this.actionsTaken = builder.actionsTaken;
        this.maxActions = builder.maxActions;
        this.gameOver = builder.gameOver;
        this.victory = builder.victory;
        this.entities = Collections.unmodifiableMap(new TreeMap<>(builder.entities));
        this.players = Collections.unmodifiableMap(new TreeMap<>(builder.players));
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getRevision() {
        return revision;
    }

    public String getStatus() {
        return status;
    }

    public long getRoundNumber() {
        return roundNumber;
    }

    public int getActionsTaken() {
        return actionsTaken;
    }

    public int getMaxActions() {
        return maxActions;
    }

    public boolean isGameOver() {
        return gameOver;
    }

    public Boolean getVictory() {
        return victory;
    }

    /**
     * Game entities keyed by entity id.
     */
    public Map<String, EntityState> getEntities() {
        return entities;
    }

    /**
     * Roster records keyed by player id.
     */
    public Map<String, EntityState> getPlayers() {
        return players;
    }

    public Builder toBuilder() {
        return new Builder()
                .sessionId(sessionId)
                .revision(revision)
                .status(status)
                .roundNumber(roundNumber)
                .actionsTaken(actionsTaken)
                .maxActions(maxActions)
                .gameOver(gameOver)
                .victory(victory)
                .entities(entities)
                .players(players);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sessionId;
        private long revision;
        private String status;
        private long roundNumber;
        private int actionsTaken;
        private int maxActions;
        private boolean gameOver;
        private Boolean victory;
        private Map<String, EntityState> entities = new TreeMap<>();
        private Map<String, EntityState> players = new TreeMap<>();

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder revision(long revision) {
            this.revision = revision;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder roundNumber(long roundNumber) {
            this.roundNumber = roundNumber;
            return this;
        }

        public Builder actionsTaken(int actionsTaken) {
            this.actionsTaken = actionsTaken;
            return this;
        }

        public Builder maxActions(int maxActions) {
            this.maxActions = maxActions;
            return this;
        }

        public Builder gameOver(boolean gameOver) {
            this.gameOver = gameOver;
            return this;
        }

        public Builder victory(Boolean victory) {
            this.victory = victory;
            return this;
        }

        public Builder entities(Map<String, EntityState> entities) {
            this.entities = new TreeMap<>(entities);
            return this;
        }

        public Builder entity(EntityState entity) {
            this.entities.put(entity.getId(), entity);
            return this;
        }

        public Builder players(Map<String, EntityState> players) {
            this.players = new TreeMap<>(players);
            return this;
        }

        public Builder player(EntityState player) {
            this.players.put(player.getId(), player);
            return this;
        }

        public StateSnapshot build() {
            return new StateSnapshot(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSnapshot)) {
            return false;
        }
        StateSnapshot other = (StateSnapshot) o;
        return revision == other.revision
                && roundNumber == other.roundNumber
                && actionsTaken == other.actionsTaken
                && maxActions == other.maxActions
                && gameOver == other.gameOver
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(status, other.status)
                && Objects.equals(victory, other.victory)
                && entities.equals(other.entities)
                && players.equals(other.players);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, revision, status, roundNumber, actionsTaken, maxActions,
                gameOver, victory, entities, players);
    }

    @Override
    public String toString() {
        return "StateSnapshot{" +
                "sessionId='" + sessionId + '\'' +
                ", revision=" + revision +
                ", status=" + status +
                ", round=" + roundNumber +
                ", actions=" + actionsTaken + "/" + maxActions +
                ", entities=" + entities.size() +
                ", players=" + players.size() +
                '}';
    }
}
