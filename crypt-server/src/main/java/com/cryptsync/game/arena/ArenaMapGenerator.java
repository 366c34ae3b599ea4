package com.cryptsync.game.arena;

import com.cryptsync.game.MapGenerator;

import java.util.Random;

/**
 * Seeded generator for {@link ArenaMap}s.
 */
public class ArenaMapGenerator implements MapGenerator {

    private final int width;
    private final int height;

    public ArenaMapGenerator(int width, int height) {
        if (width < 8 || height < 4) {
            throw new IllegalArgumentException("Arena must be at least 8x4, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public ArenaMap generate(long seed) {
        Random random = new Random(seed);
        boolean[][] walls = new boolean[width][height];
        for (int x = 0; x < width; x++) {
            walls[x][0] = true;
            walls[x][height - 1] = true;
        }
        for (int y = 0; y < height; y++) {
            walls[0][y] = true;
            walls[width - 1][y] = true;
        }

        // Pillars stay clear of the spawn columns and the column next to them
        int firstPillarColumn = ArenaMap.SPAWN_COLUMNS + 2;
        int pillars = (width * height) / 15;
        for (int i = 0; i < pillars; i++) {
            int x = firstPillarColumn + random.nextInt(width - 1 - firstPillarColumn);
            int y = 1 + random.nextInt(height - 2);
            walls[x][y] = true;
        }
        return new ArenaMap(width, height, walls);
    }
}
