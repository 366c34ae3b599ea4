package com.cryptsync.game;

import java.util.Collection;
import java.util.Optional;

/**
 * The shared, mutable state of one dungeon run.
 *
 * An instance is owned by exactly one game session and is only touched from
 * that session's serial executor. Nothing in this interface is thread-safe.
 */
public interface GameState {

    /**
     * Looks up a player-controlled entity.
     */
    Optional<EntityView> getPlayer(String entityId);

    /**
     * All entities currently in the world, including players.
     */
    Collection<? extends EntityView> getEntities();

    /**
     * Adds a player entity at the given spawn point.
     *
     * @return the new entity's id
     */
    String spawnPlayer(String playerId, String displayName, Coord spawn);

    /**
     * Removes an entity from the world, e.g. when its owner's reconnect
     * deadline has passed.
     */
    void removeEntity(String entityId);

    boolean isGameOver();

    /**
     * Meaningful only once {@link #isGameOver()} is true.
     */
    boolean isVictory();

    /**
     * Validates and, if valid, executes an action.
     */
    default Outcome apply(GameAction action) {
        if (!action.validate(this)) {
            return Outcome.failure("Action is not valid");
        }
        return action.execute(this);
    }
}
