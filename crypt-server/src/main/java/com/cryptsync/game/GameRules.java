package com.cryptsync.game;

import com.cryptsync.protocol.action.ActionCodec;

/**
 * Bundles the game collaborators a session needs: map generation, world
 * creation, the environment turn and the set of playable actions.
 */
public interface GameRules {

    MapGenerator getMapGenerator();

    /**
     * Creates an empty world (no players yet) for a generated map.
     */
    GameState newGame(DungeonMap map, long seed);

    TurnSystem getTurnSystem();

    /**
     * Registers every action type this ruleset understands.
     */
    void registerActions(ActionCodec codec);
}
