package com.cryptsync.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Incremental changes from {@code baseRevision} to {@code newRevision}.
 *
 * The header (status, round counters, game-over flags) is always present; the
 * per-id change lists only carry what differs. {@code events} are outcome
 * messages for display and are not part of the synchronized state.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class StateDelta {

    private final String sessionId;
    private final long baseRevision;
    private final long newRevision;
    private final String status;
    private final long roundNumber;
    private final int actionsTaken;
    private final int maxActions;
    private final boolean gameOver;
    private final Boolean victory;
    private final List<EntityChange> entities;
    private final List<EntityChange> players;
    private final List<String> events;
    private final boolean headerChanged;

    StateDelta(StateSnapshot base, StateSnapshot next,
               List<EntityChange> entities, List<EntityChange> players, List<String> events) {
        this.sessionId = next.getSessionId();
        this.baseRevision = base.getRevision();
        this.newRevision = next.getRevision();
        this.status = next.getStatus();
        this.roundNumber = next.getRoundNumber();
        this.actionsTaken = next.getActionsTaken();
        this.maxActions = next.getMaxActions();
        this.gameOver = next.isGameOver();
        this.victory = next.getVictory();
        this.entities = Collections.unmodifiableList(entities);
        this.players = Collections.unmodifiableList(players);
        this.events = Collections.unmodifiableList(events);
        this.headerChanged = !Objects.equals(base.getStatus(), next.getStatus())
                || base.getRoundNumber() != next.getRoundNumber()
                || base.getActionsTaken() != next.getActionsTaken()
                || base.getMaxActions() != next.getMaxActions()
                || base.isGameOver() != next.isGameOver()
                || !Objects.equals(base.getVictory(), next.getVictory());
    }

    public String getSessionId() {
        return sessionId;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public long getBaseRevision() {
        return baseRevision;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public long getNewRevision() {
        return newRevision;
    }

    public String getStatus() {
        return status;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public long getRoundNumber() {
        return roundNumber;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public int getActionsTaken() {
        return actionsTaken;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public int getMaxActions() {
        return maxActions;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public boolean isGameOver() {
        return gameOver;
    }

    public Boolean getVictory() {
        return victory;
    }

    public List<EntityChange> getEntities() {
        return entities;
    }

    public List<EntityChange> getPlayers() {
        return players;
    }

    public List<String> getEvents() {
        return events;
    }

    /**
     * True if nothing synchronized differs between the two revisions.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return !headerChanged && entities.isEmpty() && players.isEmpty();
    }

    @Override
    public String toString() {
        return "StateDelta{" +
                "sessionId='" + sessionId + '\'' +
                ", " + baseRevision + "->" + newRevision +
                ", entities=" + entities +
                ", players=" + players +
                '}';
    }
}
