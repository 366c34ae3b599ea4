package com.cryptsync.game;

/**
 * Runs the environment (monsters, hazards) once at the end of every round.
 */
public interface TurnSystem {

    void processRound(GameState state);
}
