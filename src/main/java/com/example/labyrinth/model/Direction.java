package com.example.labyrinth.model;

/**
 * Compass directions a Room can be queried in.
 * NONE is a sentinel meaning "no direction" (e.g. a Room that is not the exit room)
 * and is never a valid query argument.
 */
public enum Direction {
    NORTH("north", 0, -1),
    EAST("east", 1, 0),
    SOUTH("south", 0, 1),
    WEST("west", -1, 0),
    NONE("none", 0, 0);

    private final String key;
    private final int dx;
    private final int dy;

    Direction(String key, int dx, int dy) {
        this.key = key;
        this.dx = dx;
        this.dy = dy;
    }

    public String getKey() { return key; }
    public int getDx() { return dx; }
    public int getDy() { return dy; }

    /** The four real directions, in clockwise order starting north. */
    public static Direction[] compass() {
        return new Direction[] { NORTH, EAST, SOUTH, WEST };
    }

    public Direction opposite() {
        switch (this) {
            case NORTH: return SOUTH;
            case EAST: return WEST;
            case SOUTH: return NORTH;
            case WEST: return EAST;
            default: return NONE;
        }
    }

    public static Direction fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        switch (k) {
            case "n": return NORTH;
            case "e": return EAST;
            case "s": return SOUTH;
            case "w": return WEST;
            default: break;
        }
        for (Direction d : values()) if (d.key.equals(k)) return d;
        return null;
    }
}
