package com.example.labyrinth.model;

import com.example.labyrinth.util.MapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Owns the authoritative grid of Rooms.
 * Rooms are indexed first with the y-coordinate, then with the x-coordinate.
 * A new Labyrinth is fully walled, empty and has no exit; carving passages and
 * placing the exit is up to whoever builds it.
 */
public class Labyrinth implements LabyrinthView {
    private static final Logger logger = LoggerFactory.getLogger(Labyrinth.class);

    private final int xSize;
    private final int ySize;
    private final List<Room> rooms;
    private Coordinate exitRoom;

    public Labyrinth(int xSize, int ySize) {
        if (xSize <= 0 || ySize <= 0) {
            throw new IllegalArgumentException("Labyrinth dimensions must be positive, got " + xSize + "x" + ySize);
        }
        this.xSize = xSize;
        this.ySize = ySize;
        int roomCount;
        try {
            roomCount = Math.multiplyExact(xSize, ySize);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Labyrinth dimensions " + xSize + "x" + ySize + " are too large", e);
        }
        this.rooms = new ArrayList<>(roomCount);
        for (int i = 0; i < roomCount; i++) {
            rooms.add(new Room());
        }
    }

    @Override
    public int getXSize() { return xSize; }

    @Override
    public int getYSize() { return ySize; }

    @Override
    public MapResult<Room> roomAt(Coordinate c) {
        if (!isInBounds(c)) {
            return MapResult.invalidArgument("Coordinate " + c + " is outside of the " + xSize + "x" + ySize + " Labyrinth.");
        }
        return MapResult.success(rooms.get(indexOf(c)));
    }

    @Override
    public List<Coordinate> roomCoordinates() {
        List<Coordinate> coords = new ArrayList<>(rooms.size());
        for (int y = 0; y < ySize; y++) {
            for (int x = 0; x < xSize; x++) {
                coords.add(new Coordinate(x, y));
            }
        }
        return Collections.unmodifiableList(coords);
    }

    /**
     * Replaces the Room at c.
     * An exit room must face the outer wall, and once an exit is set it stays where it is:
     * a Room that would add a second exit, or change or remove the current one, is refused.
     */
    public MapResult<Void> setRoom(Coordinate c, Room room) {
        if (room == null) {
            return MapResult.invalidArgument("Cannot place a null Room at " + c + ".");
        }
        if (!isInBounds(c)) {
            return MapResult.invalidArgument("Coordinate " + c + " is outside of the Labyrinth.");
        }
        if (room.isExitRoom()) {
            MapResult<Void> allowed = checkExit(c, room.getExit());
            if (allowed.isFailure()) return allowed;
        } else if (c.equals(exitRoom)) {
            return MapResult.invalidArgument("Room " + c + " is the exit room; its exit cannot be removed.");
        }
        rooms.set(indexOf(c), room);
        if (room.isExitRoom()) {
            exitRoom = c;
        }
        return MapResult.ok();
    }

    /**
     * Takes down the wall between the Room at c and its neighbour in d, on both sides.
     */
    public MapResult<Void> connect(Coordinate c, Direction d) {
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("connect() was given the direction " + d + ".");
        }
        if (!isInBounds(c)) {
            return MapResult.invalidArgument("Coordinate " + c + " is outside of the Labyrinth.");
        }
        Coordinate neighbour = c.step(d).getValue();
        if (!isInBounds(neighbour)) {
            return MapResult.invalidArgument("Room " + c + " has no neighbour to the " + d.getKey() + ".");
        }
        rooms.set(indexOf(c), rooms.get(indexOf(c)).withWallRemoved(d));
        rooms.set(indexOf(neighbour), rooms.get(indexOf(neighbour)).withWallRemoved(d.opposite()));
        logger.debug("Connected {} and {}", c, neighbour);
        return MapResult.ok();
    }

    /**
     * Makes the Room at c the exit room, leaving the Labyrinth through its side d.
     * d must face the outer boundary. The exit can only be set once; repeating the same
     * call is allowed, moving the exit is not.
     */
    public MapResult<Void> setExit(Coordinate c, Direction d) {
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("setExit() was given the direction " + d + ".");
        }
        if (!isInBounds(c)) {
            return MapResult.invalidArgument("Coordinate " + c + " is outside of the Labyrinth.");
        }
        MapResult<Void> allowed = checkExit(c, d);
        if (allowed.isFailure()) return allowed;
        rooms.set(indexOf(c), rooms.get(indexOf(c)).withExit(d));
        exitRoom = c;
        logger.debug("Exit set at {} facing {}", c, d.getKey());
        return MapResult.ok();
    }

    private MapResult<Void> checkExit(Coordinate c, Direction d) {
        if (isInBounds(c.step(d).getValue())) {
            return MapResult.invalidArgument("The exit must face the outer wall; " + c + " has a Room to the " + d.getKey() + ".");
        }
        if (exitRoom != null) {
            Direction current = rooms.get(indexOf(exitRoom)).getExit();
            if (!exitRoom.equals(c) || current != d) {
                return MapResult.invalidArgument("The exit is already set at " + exitRoom + " facing "
                    + current.getKey() + "; it cannot be moved.");
            }
        }
        return MapResult.ok();
    }

    /** Coordinate of the exit room, if one has been set. */
    public Optional<Coordinate> getExitRoom() {
        return Optional.ofNullable(exitRoom);
    }

    public MapResult<Void> setInhabitant(Coordinate c, Inhabitant inhabitant) {
        return roomAt(c).map(room -> {
            room.setInhabitant(inhabitant);
            return null;
        });
    }

    public MapResult<Void> setItem(Coordinate c, Item item) {
        return roomAt(c).map(room -> {
            room.setItem(item);
            return null;
        });
    }

    /**
     * Moves whoever is in the Room at from into the Room at to.
     * Anyone already in the destination is replaced.
     */
    public MapResult<Void> moveInhabitant(Coordinate from, Coordinate to) {
        MapResult<Room> source = roomAt(from);
        if (source.isFailure()) return source.propagate();
        MapResult<Room> target = roomAt(to);
        if (target.isFailure()) return target.propagate();

        Inhabitant moving = source.getValue().getInhabitant();
        if (moving == Inhabitant.NONE) {
            return MapResult.invalidArgument("There is no inhabitant at " + from + " to move.");
        }
        source.getValue().setInhabitant(Inhabitant.NONE);
        target.getValue().setInhabitant(moving);
        logger.debug("{} moved from {} to {}", moving.getDisplayName(), from, to);
        return MapResult.ok();
    }

    /** First Room (row-major) holding the given inhabitant. */
    public Optional<Coordinate> findInhabitant(Inhabitant inhabitant) {
        for (Coordinate c : roomCoordinates()) {
            if (rooms.get(indexOf(c)).getInhabitant() == inhabitant) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    private int indexOf(Coordinate c) {
        return c.y() * xSize + c.x();
    }
}
