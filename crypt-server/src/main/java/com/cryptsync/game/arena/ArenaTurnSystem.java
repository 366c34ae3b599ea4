package com.cryptsync.game.arena;

import com.cryptsync.game.Coord;
import com.cryptsync.game.GameState;
import com.cryptsync.game.TurnSystem;

import java.util.List;

/**
 * Monsters act in id order: strike an adjacent player, otherwise step toward
 * the nearest one.
 */
public class ArenaTurnSystem implements TurnSystem {

    @Override
    public void processRound(GameState state) {
        ArenaGameState arena = (ArenaGameState) state;
        for (ArenaEntity monster : arena.livingOfKind(ArenaEntity.MONSTER)) {
            ArenaEntity target = nearestPlayer(arena, monster);
            if (target == null) {
                return;
            }
            Coord from = monster.getPosition();
            if (from.distanceTo(target.getPosition()) == 1) {
                target.damage(monster.getAttack());
                continue;
            }
            int dx = Integer.signum(target.getPosition().getX() - from.getX());
            int dy = Integer.signum(target.getPosition().getY() - from.getY());
            for (Coord candidate : new Coord[]{from.offset(dx, dy), from.offset(dx, 0), from.offset(0, dy)}) {
                if (!candidate.equals(from) && arena.isFree(candidate)) {
                    monster.setPosition(candidate);
                    break;
                }
            }
        }
    }

    private static ArenaEntity nearestPlayer(ArenaGameState arena, ArenaEntity monster) {
        List<ArenaEntity> players = arena.livingOfKind(ArenaEntity.PLAYER);
        ArenaEntity best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (ArenaEntity player : players) {
            int distance = monster.getPosition().distanceTo(player.getPosition());
            if (distance < bestDistance) {
                best = player;
                bestDistance = distance;
            }
        }
        return best;
    }
}
