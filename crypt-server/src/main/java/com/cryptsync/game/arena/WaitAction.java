package com.cryptsync.game.arena;

import com.cryptsync.game.Outcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code WAIT}: spend an action doing nothing.
 */
public class WaitAction extends ArenaAction {

    public WaitAction(String actorId) {
        super(actorId);
    }

    public static WaitAction fromParams(String actorId, JsonNode params) {
        return new WaitAction(actorId);
    }

    @Override
    protected boolean validate(ArenaGameState arena, ArenaEntity actor) {
        return true;
    }

    @Override
    protected Outcome execute(ArenaGameState arena, ArenaEntity actor) {
        return Outcome.success(actor.getName() + " waits");
    }
}
