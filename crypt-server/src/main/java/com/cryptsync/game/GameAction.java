package com.cryptsync.game;

/**
 * A single player action, created by the action codec from a wire request.
 *
 * {@link #validate} must not mutate the state. {@link #execute} is only called
 * after a successful validation, within the same serialized step.
 */
public interface GameAction {

    /**
     * Entity id of the actor.
     */
    String getActorId();

    boolean validate(GameState context);

    /**
     * Applies the action. A failed {@link Outcome} must leave the state exactly
     * as it was; a failure that changed anything ends the session as corrupted.
     */
    Outcome execute(GameState context);
}
