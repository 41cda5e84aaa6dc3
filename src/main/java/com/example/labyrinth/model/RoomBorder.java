package com.example.labyrinth.model;

/**
 * Classification of one side of a Room.
 * Ordered by openness: a higher rank is more open.
 */
public enum RoomBorder {
    WALL(0),
    ROOM(1),
    EXIT(2);

    private final int openness;

    RoomBorder(int openness) {
        this.openness = openness;
    }

    public int getOpenness() { return openness; }

    /** Returns whichever of the two borders is more open. */
    public RoomBorder mostOpen(RoomBorder other) {
        if (other == null) return this;
        return other.openness > openness ? other : this;
    }
}
