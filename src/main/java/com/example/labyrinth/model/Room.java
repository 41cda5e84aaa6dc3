package com.example.labyrinth.model;

import com.example.labyrinth.util.MapResult;

/**
 * Atomic maze cell: one exit direction (or NONE), four wall flags, an inhabitant and an item.
 * Walls and exit are fixed when the Room is built; only the inhabitant and item change afterwards.
 */
public class Room {
    private final Direction exit;
    private final boolean wallNorth;
    private final boolean wallEast;
    private final boolean wallSouth;
    private final boolean wallWest;

    private Inhabitant inhabitant;
    private Item item;

    /** A fully walled, empty Room that is not the exit room. */
    public Room() {
        this(Inhabitant.NONE, Item.NONE, Direction.NONE, true, true, true, true);
    }

    public Room(Inhabitant inhabitant, Item item, Direction exit,
                boolean wallNorth, boolean wallEast, boolean wallSouth, boolean wallWest) {
        this.inhabitant = inhabitant == null ? Inhabitant.NONE : inhabitant;
        this.item = item == null ? Item.NONE : item;
        this.exit = exit == null ? Direction.NONE : exit;
        this.wallNorth = wallNorth;
        this.wallEast = wallEast;
        this.wallSouth = wallSouth;
        this.wallWest = wallWest;
    }

    public Inhabitant getInhabitant() { return inhabitant; }

    public void setInhabitant(Inhabitant inhabitant) {
        this.inhabitant = inhabitant == null ? Inhabitant.NONE : inhabitant;
    }

    public Item getItem() { return item; }

    public void setItem(Item item) {
        this.item = item == null ? Item.NONE : item;
    }

    public Direction getExit() { return exit; }

    public boolean isExitRoom() { return exit != Direction.NONE; }

    /**
     * Classifies one side of this Room.
     * The exit direction is checked first and wins over that side's wall flag.
     * @return EXIT if d is the exit direction, ROOM if there is no wall in d, WALL otherwise;
     *         INVALID_ARGUMENT if d is NONE
     */
    public MapResult<RoomBorder> directionCheck(Direction d) {
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("directionCheck() was given the direction " + d + ".");
        }
        if (d == exit) {
            return MapResult.success(RoomBorder.EXIT);
        }
        return MapResult.success(hasWall(d) ? RoomBorder.WALL : RoomBorder.ROOM);
    }

    /** Copy of this Room with the wall in d taken down. Inhabitant and item carry over. */
    public Room withWallRemoved(Direction d) {
        return new Room(inhabitant, item, exit,
            wallNorth && d != Direction.NORTH,
            wallEast && d != Direction.EAST,
            wallSouth && d != Direction.SOUTH,
            wallWest && d != Direction.WEST);
    }

    /** Copy of this Room with a different exit direction (NONE clears it). */
    public Room withExit(Direction d) {
        return new Room(inhabitant, item, d, wallNorth, wallEast, wallSouth, wallWest);
    }

    private boolean hasWall(Direction d) {
        switch (d) {
            case NORTH: return wallNorth;
            case EAST: return wallEast;
            case SOUTH: return wallSouth;
            case WEST: return wallWest;
            default: return true;
        }
    }
}
