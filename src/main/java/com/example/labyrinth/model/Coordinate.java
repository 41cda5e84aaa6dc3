package com.example.labyrinth.model;

import com.example.labyrinth.util.MapResult;

/**
 * A two-axis grid position. The same type is used in Labyrinth space (one cell per Room)
 * and in Map space (Rooms at odd/odd positions, Borders everywhere else).
 * x grows east, y grows south.
 */
public record Coordinate(int x, int y) {

    public static Coordinate of(int x, int y) {
        return new Coordinate(x, y);
    }

    /** True if 0 <= x < xSize and 0 <= y < ySize. */
    public boolean isWithin(int xSize, int ySize) {
        return x >= 0 && y >= 0 && x < xSize && y < ySize;
    }

    /** The adjacent coordinate one step in the given direction, in the same space. */
    public MapResult<Coordinate> step(Direction d) {
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("Cannot step from " + this + " in direction " + d + ".");
        }
        return MapResult.success(new Coordinate(x + d.getDx(), y + d.getDy()));
    }

    /** Scale-and-offset into Map space: (2x+1, 2y+1). No bounds checking. */
    public Coordinate toMapSpace() {
        return new Coordinate(2 * x + 1, 2 * y + 1);
    }

    /** Inverse of {@link #toMapSpace()}; only meaningful when {@link #isRoomPosition()}. */
    public Coordinate toLabyrinthSpace() {
        return new Coordinate((x - 1) / 2, (y - 1) / 2);
    }

    /** True if this Map-space coordinate lands on a Room cell (both coordinates odd). */
    public boolean isRoomPosition() {
        return (x & 1) == 1 && (y & 1) == 1;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
