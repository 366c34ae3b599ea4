package com.cryptsync.game;

import java.util.List;

/**
 * A generated dungeon level, produced by a {@link MapGenerator}.
 */
public interface DungeonMap {

    int getWidth();

    int getHeight();

    boolean inBounds(int x, int y);

    boolean isWalkable(int x, int y);

    /**
     * Picks starting positions for {@code count} players.
     *
     * Implementations should return {@code count} distinct walkable
     * coordinates. The session refuses to start if they do not.
     */
    List<Coord> findSpawnPositions(int count);
}
