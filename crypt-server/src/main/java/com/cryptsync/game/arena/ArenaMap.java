package com.cryptsync.game.arena;

import com.cryptsync.game.Coord;
import com.cryptsync.game.DungeonMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Walled rectangle with scattered pillars. Players start on the west side.
 */
public class ArenaMap implements DungeonMap {

    /** Columns reserved for spawning; never blocked by pillars. */
    static final int SPAWN_COLUMNS = 2;

    private final int width;
    private final int height;
    private final boolean[][] walls;

    ArenaMap(int width, int height, boolean[][] walls) {
        this.width = width;
        this.height = height;
        this.walls = walls;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    @Override
    public boolean isWalkable(int x, int y) {
        return inBounds(x, y) && !walls[x][y];
    }

    public boolean isWalkable(Coord c) {
        return isWalkable(c.getX(), c.getY());
    }

    /**
     * Walkable cells of the spawn columns, scanned column by column from the top.
     * Returns fewer than {@code count} positions if the map cannot fit them.
     */
    @Override
    public List<Coord> findSpawnPositions(int count) {
        List<Coord> spawns = new ArrayList<>();
        for (int x = 1; x <= SPAWN_COLUMNS && spawns.size() < count; x++) {
            for (int y = 1; y < height - 1 && spawns.size() < count; y++) {
                if (isWalkable(x, y)) {
                    spawns.add(new Coord(x, y));
                }
            }
        }
        return spawns;
    }
}
