package com.example.labyrinth.model;

import com.example.labyrinth.util.MapResult;

import java.util.List;

/**
 * Query interface onto a Labyrinth: its dimensions, a bounded Room lookup and
 * an enumeration of every Room coordinate. The interface itself has no mutators,
 * but the Rooms it hands out are the Labyrinth's own.
 */
public interface LabyrinthView {

    int getXSize();

    int getYSize();

    /**
     * The Room at a logical coordinate. This is the Labyrinth's live Room, not a copy:
     * changing its inhabitant or item changes the Labyrinth.
     * @return INVALID_ARGUMENT if c lies outside the Labyrinth
     */
    MapResult<Room> roomAt(Coordinate c);

    /** Every valid Room coordinate, row-major. */
    List<Coordinate> roomCoordinates();

    default boolean isInBounds(Coordinate c) {
        return c != null && c.isWithin(getXSize(), getYSize());
    }
}
