package com.cryptsync.game.arena;

import com.cryptsync.game.Outcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code PICKUP}: take the item lying on the actor's cell.
 */
public class PickupAction extends ArenaAction {

    public PickupAction(String actorId) {
        super(actorId);
    }

    public static PickupAction fromParams(String actorId, JsonNode params) {
        return new PickupAction(actorId);
    }

    @Override
    protected boolean validate(ArenaGameState arena, ArenaEntity actor) {
        return arena.itemAt(actor.getPosition()).isPresent();
    }

    @Override
    protected Outcome execute(ArenaGameState arena, ArenaEntity actor) {
        ArenaEntity item = arena.itemAt(actor.getPosition()).orElseThrow();
        actor.addToInventory(item.getName());
        arena.removeEntity(item.getId());
        return Outcome.success(actor.getName() + " picks up a " + item.getName());
    }
}
