package com.cryptsync.game;

/**
 * An immutable map coordinate.
 */
public final class Coord {

    private final int x;
    private final int y;

    public Coord(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public Coord offset(int dx, int dy) {
        return new Coord(x + dx, y + dy);
    }

    /**
     * Chebyshev distance, so diagonal neighbours are at distance 1.
     */
    public int distanceTo(Coord other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coord)) {
            return false;
        }
        Coord other = (Coord) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
