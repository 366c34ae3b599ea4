package com.cryptsync.game.arena;

import com.cryptsync.game.Coord;
import com.cryptsync.game.EntityView;
import com.cryptsync.game.GameState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * World of one arena game: the map plus players, goblins and loot.
 *
 * Monsters start in the east half, loot in between. The party wins once
 * every monster is dead and loses once no player is alive.
 */
public class ArenaGameState implements GameState {

    private static final String[] LOOT = {"potion", "gem", "scroll"};

    private final ArenaMap map;
    private final Map<String, ArenaEntity> entities = new LinkedHashMap<>();
    private boolean anyPlayerSpawned;

    public ArenaGameState(ArenaMap map, long seed, int monsters, int items) {
        this.map = map;
        Random random = new Random(seed);
        int half = map.getWidth() / 2;
        for (int i = 1; i <= monsters; i++) {
            Coord c = freeCell(random, half, map.getWidth() - 1);
            if (c != null) {
                add(ArenaEntity.monster("m" + i, c));
            }
        }
        for (int i = 1; i <= items; i++) {
            Coord c = freeCell(random, ArenaMap.SPAWN_COLUMNS + 1, half);
            if (c != null) {
                add(ArenaEntity.item("i" + i, LOOT[(i - 1) % LOOT.length], c));
            }
        }
    }

    private Coord freeCell(Random random, int fromX, int toX) {
        if (toX <= fromX) {
            return null;
        }
        for (int attempt = 0; attempt < 200; attempt++) {
            Coord c = new Coord(fromX + random.nextInt(toX - fromX), 1 + random.nextInt(map.getHeight() - 2));
            if (map.isWalkable(c) && entityAt(c).isEmpty()) {
                return c;
            }
        }
        return null;
    }

    void add(ArenaEntity entity) {
        entities.put(entity.getId(), entity);
    }

    public ArenaMap getMap() {
        return map;
    }

    @Override
    public Optional<EntityView> getPlayer(String entityId) {
        ArenaEntity entity = entities.get(entityId);
        if (entity == null || !ArenaEntity.PLAYER.equals(entity.getKind())) {
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    public ArenaEntity getEntity(String entityId) {
        return entities.get(entityId);
    }

    @Override
    public Collection<ArenaEntity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    @Override
    public String spawnPlayer(String playerId, String displayName, Coord spawn) {
        if (!map.isWalkable(spawn)) {
            throw new IllegalArgumentException("Spawn " + spawn + " is not walkable");
        }
        ArenaEntity player = ArenaEntity.player(playerId, displayName, spawn);
        add(player);
        anyPlayerSpawned = true;
        return player.getId();
    }

    @Override
    public void removeEntity(String entityId) {
        entities.remove(entityId);
    }

    /**
     * Living creatures (players and monsters) at {@code c}.
     */
    public Optional<ArenaEntity> creatureAt(Coord c) {
        for (ArenaEntity e : entities.values()) {
            if (e.isCreature() && e.isAlive() && e.getPosition().equals(c)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public Optional<ArenaEntity> itemAt(Coord c) {
        for (ArenaEntity e : entities.values()) {
            if (!e.isCreature() && e.getPosition().equals(c)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    private Optional<ArenaEntity> entityAt(Coord c) {
        for (ArenaEntity e : entities.values()) {
            if (e.getPosition().equals(c)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * Cell is inside the walls and not taken by a living creature.
     */
    public boolean isFree(Coord c) {
        return map.isWalkable(c) && creatureAt(c).isEmpty();
    }

    public List<ArenaEntity> livingOfKind(String kind) {
        List<ArenaEntity> result = new ArrayList<>();
        for (ArenaEntity e : entities.values()) {
            if (kind.equals(e.getKind()) && e.isAlive()) {
                result.add(e);
            }
        }
        result.sort(Comparator.comparing(ArenaEntity::getId));
        return result;
    }

    @Override
    public boolean isGameOver() {
        return livingOfKind(ArenaEntity.MONSTER).isEmpty()
                || (anyPlayerSpawned && livingOfKind(ArenaEntity.PLAYER).isEmpty());
    }

    @Override
    public boolean isVictory() {
        return livingOfKind(ArenaEntity.MONSTER).isEmpty() && !livingOfKind(ArenaEntity.PLAYER).isEmpty();
    }
}
