package com.cryptsync.game.arena;

import com.cryptsync.game.DungeonMap;
import com.cryptsync.game.GameRules;
import com.cryptsync.game.GameState;
import com.cryptsync.game.MapGenerator;
import com.cryptsync.game.TurnSystem;
import com.cryptsync.protocol.action.ActionCodec;

/**
 * The built-in ruleset: a small arena, a few goblins and some loot.
 */
public class ArenaRules implements GameRules {

    public static final int DEFAULT_WIDTH = 20;
    public static final int DEFAULT_HEIGHT = 12;

    private final ArenaMapGenerator mapGenerator;
    private final ArenaTurnSystem turnSystem = new ArenaTurnSystem();
    private final int monsters;
    private final int items;

    public ArenaRules() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT, 3, 3);
    }

    public ArenaRules(int width, int height, int monsters, int items) {
        this.mapGenerator = new ArenaMapGenerator(width, height);
        this.monsters = monsters;
        this.items = items;
    }

    @Override
    public MapGenerator getMapGenerator() {
        return mapGenerator;
    }

    @Override
    public GameState newGame(DungeonMap map, long seed) {
        return new ArenaGameState((ArenaMap) map, seed, monsters, items);
    }

    @Override
    public TurnSystem getTurnSystem() {
        return turnSystem;
    }

    @Override
    public void registerActions(ActionCodec codec) {
        codec.register("MOVE", MoveAction::fromParams);
        codec.register("ATTACK", AttackAction::fromParams);
        codec.register("PICKUP", PickupAction::fromParams);
        codec.register("WAIT", WaitAction::fromParams);
    }
}
