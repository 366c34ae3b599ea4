package com.cryptsync.game;

/**
 * Builds a dungeon level from a seed. The same seed must yield the same map.
 */
public interface MapGenerator {

    DungeonMap generate(long seed);
}
