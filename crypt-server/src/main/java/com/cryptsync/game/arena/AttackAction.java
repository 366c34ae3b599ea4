package com.cryptsync.game.arena;

import com.cryptsync.game.Outcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code ATTACK {target}}: strike an adjacent monster. Slain monsters are
 * removed from the world.
 */
public class AttackAction extends ArenaAction {

    private final String targetId;

    public AttackAction(String actorId, String targetId) {
        super(actorId);
        this.targetId = targetId;
    }

    public static AttackAction fromParams(String actorId, JsonNode params) {
        JsonNode target = params.get("target");
        if (target == null || !target.isTextual() || target.asText().isBlank()) {
            throw new IllegalArgumentException("'target' must be an entity id");
        }
        return new AttackAction(actorId, target.asText());
    }

    @Override
    protected boolean validate(ArenaGameState arena, ArenaEntity actor) {
        ArenaEntity target = arena.getEntity(targetId);
        return target != null
                && ArenaEntity.MONSTER.equals(target.getKind())
                && target.isAlive()
                && actor.getPosition().distanceTo(target.getPosition()) == 1;
    }

    @Override
    protected Outcome execute(ArenaGameState arena, ArenaEntity actor) {
        ArenaEntity target = arena.getEntity(targetId);
        int dealt = target.damage(actor.getAttack());
        if (!target.isAlive()) {
            arena.removeEntity(targetId);
            return Outcome.success(actor.getName() + " hits " + target.getName() + " for " + dealt,
                    target.getName() + " dies");
        }
        return Outcome.success(actor.getName() + " hits " + target.getName() + " for " + dealt);
    }
}
