package com.cryptsync.game.arena;

import com.cryptsync.game.Coord;
import com.cryptsync.game.Outcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code MOVE {dx, dy}}: step one cell in any of the eight directions.
 */
public class MoveAction extends ArenaAction {

    private final int dx;
    private final int dy;

    public MoveAction(String actorId, int dx, int dy) {
        super(actorId);
        this.dx = dx;
        this.dy = dy;
    }

    public static MoveAction fromParams(String actorId, JsonNode params) {
        int dx = step(params, "dx");
        int dy = step(params, "dy");
        if (dx == 0 && dy == 0) {
            throw new IllegalArgumentException("Move must change position");
        }
        return new MoveAction(actorId, dx, dy);
    }

    @Override
    protected boolean validate(ArenaGameState arena, ArenaEntity actor) {
        return arena.isFree(actor.getPosition().offset(dx, dy));
    }

    @Override
    protected Outcome execute(ArenaGameState arena, ArenaEntity actor) {
        Coord target = actor.getPosition().offset(dx, dy);
        actor.setPosition(target);
        return Outcome.success(actor.getName() + " moves to " + target);
    }
}
