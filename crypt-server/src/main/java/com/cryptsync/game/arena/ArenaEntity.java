package com.cryptsync.game.arena;

import com.cryptsync.game.Coord;
import com.cryptsync.game.EntityView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A player, monster or floor item in the arena. Mutable, owned by
 * {@link ArenaGameState}.
 */
public class ArenaEntity implements EntityView {

    public static final String PLAYER = "player";
    public static final String MONSTER = "monster";
    public static final String ITEM = "item";

    private final String id;
    private final String kind;
    private final String name;
    private final String ownerId;
    private final int maxHp;
    private final int attack;
    private final List<String> inventory = new ArrayList<>();
    private Coord position;
    private int hp;

    ArenaEntity(String id, String kind, String name, String ownerId, Coord position, int maxHp, int attack) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.ownerId = ownerId;
        this.position = position;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.attack = attack;
    }

    static ArenaEntity player(String playerId, String name, Coord position) {
        return new ArenaEntity("p:" + playerId, PLAYER, name, playerId, position, 10, 3);
    }

    static ArenaEntity monster(String id, Coord position) {
        return new ArenaEntity(id, MONSTER, "goblin", null, position, 5, 2);
    }

    static ArenaEntity item(String id, String itemName, Coord position) {
        return new ArenaEntity(id, ITEM, itemName, null, position, 0, 0);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public boolean isAlive() {
        return ITEM.equals(kind) || hp > 0;
    }

    public boolean isCreature() {
        return !ITEM.equals(kind);
    }

    public String getName() {
        return name;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Coord getPosition() {
        return position;
    }

    void setPosition(Coord position) {
        this.position = position;
    }

    public int getHp() {
        return hp;
    }

    public int getMaxHp() {
        return maxHp;
    }

    public int getAttack() {
        return attack;
    }

    /**
     * @return the damage actually dealt
     */
    int damage(int amount) {
        int dealt = Math.min(hp, amount);
        hp -= dealt;
        return dealt;
    }

    public List<String> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    void addToInventory(String itemName) {
        inventory.add(itemName);
    }

    @Override
    public Map<String, Object> getCanonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("x", position.getX());
        fields.put("y", position.getY());
        if (isCreature()) {
            fields.put("hp", hp);
            fields.put("max_hp", maxHp);
        }
        if (PLAYER.equals(kind)) {
            fields.put("owner", ownerId);
            fields.put("inventory", new ArrayList<>(inventory));
        }
        return fields;
    }

    @Override
    public Map<String, Object> getDisplayHints() {
        Map<String, Object> hints = new LinkedHashMap<>();
        hints.put("glyph", PLAYER.equals(kind) ? "@" : MONSTER.equals(kind) ? "g" : "!");
        if (isCreature()) {
            hints.put("health_bar", maxHp == 0 ? 0.0 : (double) hp / maxHp);
        }
        return hints;
    }

    @Override
    public String toString() {
        return id + "(" + name + " " + position + " hp=" + hp + ")";
    }
}
