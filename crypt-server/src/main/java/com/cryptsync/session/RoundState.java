package com.cryptsync.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Round bookkeeping of one game session.
 *
 * Thread Safety:
 * - Not thread-safe. Only the owning session's executor touches it.
 */
class RoundState {

    private final int maxActionsPerRound;

    private long roundNumber = 1;
    private int actionsTaken;
    private final Set<String> readySet = new LinkedHashSet<>();
    private final Set<String> passedSet = new LinkedHashSet<>();
    private final List<ActionEnvelope> roundLog = new ArrayList<>();

    RoundState(int maxActionsPerRound) {
        if (maxActionsPerRound <= 0) {
            throw new IllegalArgumentException("maxActionsPerRound must be positive");
        }
        this.maxActionsPerRound = maxActionsPerRound;
    }

    long getRoundNumber() {
        return roundNumber;
    }

    int getActionsTaken() {
        return actionsTaken;
    }

    int getMaxActionsPerRound() {
        return maxActionsPerRound;
    }

    boolean isBudgetExhausted() {
        return actionsTaken >= maxActionsPerRound;
    }

    void record(ActionEnvelope envelope) {
        if (isBudgetExhausted()) {
            throw new IllegalStateException("Round " + roundNumber + " has no actions left");
        }
        actionsTaken++;
        roundLog.add(envelope);
        passedSet.remove(envelope.getPlayerId());
    }

    /**
     * Closes the current round and opens the next one.
     */
    void advance() {
        roundNumber++;
        actionsTaken = 0;
        passedSet.clear();
        roundLog.clear();
    }

    // === Lobby readiness ===

    boolean setReady(String playerId, boolean ready) {
        return ready ? readySet.add(playerId) : readySet.remove(playerId);
    }

    boolean isReady(String playerId) {
        return readySet.contains(playerId);
    }

    int getReadyCount() {
        return readySet.size();
    }

    void clearReady() {
        readySet.clear();
    }

    // === Passing ===

    boolean markPassed(String playerId) {
        return passedSet.add(playerId);
    }

    boolean hasPassed(String playerId) {
        return passedSet.contains(playerId);
    }

    void forget(String playerId) {
        readySet.remove(playerId);
        passedSet.remove(playerId);
    }

    List<ActionEnvelope> getRoundLog() {
        return Collections.unmodifiableList(roundLog);
    }
}
