package com.cryptsync.game.arena;

import com.cryptsync.game.GameAction;
import com.cryptsync.game.GameState;
import com.cryptsync.game.Outcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base class of the arena actions. Only applies to {@link ArenaGameState}s
 * and only to living player actors.
 */
public abstract class ArenaAction implements GameAction {

    private final String actorId;

    protected ArenaAction(String actorId) {
        this.actorId = actorId;
    }

    @Override
    public String getActorId() {
        return actorId;
    }

    @Override
    public final boolean validate(GameState context) {
        if (!(context instanceof ArenaGameState)) {
            return false;
        }
        ArenaGameState arena = (ArenaGameState) context;
        ArenaEntity actor = arena.getEntity(actorId);
        if (actor == null || !ArenaEntity.PLAYER.equals(actor.getKind()) || !actor.isAlive()) {
            return false;
        }
        return validate(arena, actor);
    }

    @Override
    public final Outcome execute(GameState context) {
        ArenaGameState arena = (ArenaGameState) context;
        return execute(arena, arena.getEntity(actorId));
    }

    protected abstract boolean validate(ArenaGameState arena, ArenaEntity actor);

    protected abstract Outcome execute(ArenaGameState arena, ArenaEntity actor);

    /**
     * Reads a required integer parameter in [-1, 1].
     */
    static int step(JsonNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        int value = node.intValue();
        if (value < -1 || value > 1) {
            throw new IllegalArgumentException("'" + field + "' must be -1, 0 or 1");
        }
        return value;
    }
}
