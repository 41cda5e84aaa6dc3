package com.example.labyrinth.map;

import com.example.labyrinth.model.Direction;
import com.example.labyrinth.model.Inhabitant;
import com.example.labyrinth.model.RoomBorder;
import com.example.labyrinth.util.MapResult;

import java.util.Objects;

/**
 * One cell of a {@link LabyrinthMap}. A cell is either a Border or a Room, fixed when it is created.
 * <p>
 * A Border is the boundary between 2 Rooms, the corner between 4 Rooms, or a piece of the
 * outermost wall. Borders start fully walled with no exit so the outer wall needs no special case.
 * A Room cell starts with no inhabitant and no treasure.
 * <p>
 * Each shape only answers its own operations; asking a Room for a wall (or a Border for an
 * inhabitant) fails with SHAPE_MISMATCH. Use {@link #isRoom()} to find out which shape a cell has.
 */
public final class LabyrinthMapCoordinate {

    public enum Shape { BORDER, ROOM }

    private final Shape shape;
    private final BorderState border;
    private final RoomState room;

    private LabyrinthMapCoordinate(Shape shape) {
        this.shape = shape;
        this.border = shape == Shape.BORDER ? new BorderState() : null;
        this.room = shape == Shape.ROOM ? new RoomState() : null;
    }

    public static LabyrinthMapCoordinate border() {
        return new LabyrinthMapCoordinate(Shape.BORDER);
    }

    public static LabyrinthMapCoordinate room() {
        return new LabyrinthMapCoordinate(Shape.ROOM);
    }

    public Shape getShape() { return shape; }

    public boolean isRoom() { return shape == Shape.ROOM; }

    // ==================== Border-only ====================

    /**
     * Whether this Border still has its wall on side d.
     * @return INVALID_ARGUMENT if d is NONE
     */
    public MapResult<Boolean> isWall(Direction d) {
        if (border == null) return borderOnly("isWall");
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("isWall() was given the direction " + d + ".");
        }
        return MapResult.success(border.wallAt(d));
    }

    /**
     * Takes down the wall on side d. Removing a wall that is already gone is allowed.
     * @return INVALID_ARGUMENT if d is NONE
     */
    public MapResult<Void> removeWall(Direction d) {
        if (border == null) return borderOnly("removeWall");
        if (d == null || d == Direction.NONE) {
            return MapResult.invalidArgument("removeWall() was given the direction " + d + ".");
        }
        border.removeWall(d);
        return MapResult.ok();
    }

    public MapResult<Boolean> isExit() {
        if (border == null) return borderOnly("isExit");
        return MapResult.success(border.exit);
    }

    /** Sets or clears the exit flag; setting it twice, or clearing it when unset, is allowed. */
    public MapResult<Void> setExit(boolean exit) {
        if (border == null) return borderOnly("setExit");
        border.exit = exit;
        return MapResult.ok();
    }

    /**
     * The most open state this Border has been given: EXIT if flagged as the exit,
     * ROOM if any of its walls was taken down, WALL otherwise.
     */
    public MapResult<RoomBorder> classify() {
        if (border == null) return borderOnly("classify");
        if (border.exit) return MapResult.success(RoomBorder.EXIT);
        return MapResult.success(border.anyWallRemoved() ? RoomBorder.ROOM : RoomBorder.WALL);
    }

    // ==================== Room-only ====================

    /** The inhabitant of this Room, possibly {@link Inhabitant#NONE}. */
    public MapResult<Inhabitant> hasInhabitant() {
        if (room == null) return roomOnly("hasInhabitant");
        return MapResult.success(room.inhabitant);
    }

    public MapResult<Void> setInhabitant(Inhabitant inhabitant) {
        if (room == null) return roomOnly("setInhabitant");
        room.inhabitant = inhabitant == null ? Inhabitant.NONE : inhabitant;
        return MapResult.ok();
    }

    public MapResult<Boolean> hasTreasure() {
        if (room == null) return roomOnly("hasTreasure");
        return MapResult.success(room.treasure);
    }

    public MapResult<Void> setTreasure(boolean treasure) {
        if (room == null) return roomOnly("setTreasure");
        room.treasure = treasure;
        return MapResult.ok();
    }

    // ==================== Copying / equality ====================

    /** An independent cell with the same shape and state. */
    public LabyrinthMapCoordinate copy() {
        LabyrinthMapCoordinate c = new LabyrinthMapCoordinate(shape);
        if (border != null) {
            c.border.wallNorth = border.wallNorth;
            c.border.wallEast = border.wallEast;
            c.border.wallSouth = border.wallSouth;
            c.border.wallWest = border.wallWest;
            c.border.exit = border.exit;
        } else {
            c.room.inhabitant = room.inhabitant;
            c.room.treasure = room.treasure;
        }
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabyrinthMapCoordinate)) return false;
        LabyrinthMapCoordinate other = (LabyrinthMapCoordinate) o;
        if (shape != other.shape) return false;
        if (border != null) {
            return border.wallNorth == other.border.wallNorth
                && border.wallEast == other.border.wallEast
                && border.wallSouth == other.border.wallSouth
                && border.wallWest == other.border.wallWest
                && border.exit == other.border.exit;
        }
        return room.inhabitant == other.room.inhabitant && room.treasure == other.room.treasure;
    }

    @Override
    public int hashCode() {
        if (border != null) {
            return Objects.hash(shape, border.wallNorth, border.wallEast, border.wallSouth, border.wallWest, border.exit);
        }
        return Objects.hash(shape, room.inhabitant, room.treasure);
    }

    @Override
    public String toString() {
        if (border != null) {
            return "Border[N=" + border.wallNorth + ", E=" + border.wallEast + ", S=" + border.wallSouth
                + ", W=" + border.wallWest + ", exit=" + border.exit + "]";
        }
        return "Room[inhabitant=" + room.inhabitant + ", treasure=" + room.treasure + "]";
    }

    private <T> MapResult<T> borderOnly(String method) {
        return MapResult.shapeMismatch("A Room cell was asked to " + method + "(), which is a Border-only method. "
            + "Consider using isRoom() to check whether the cell is a Border or Room.");
    }

    private <T> MapResult<T> roomOnly(String method) {
        return MapResult.shapeMismatch("A Border cell was asked to " + method + "(), which is a Room-only method. "
            + "Consider using isRoom() to check whether the cell is a Border or Room.");
    }

    private static final class BorderState {
        boolean wallNorth = true;
        boolean wallEast = true;
        boolean wallSouth = true;
        boolean wallWest = true;
        boolean exit = false;

        boolean wallAt(Direction d) {
            switch (d) {
                case NORTH: return wallNorth;
                case EAST: return wallEast;
                case SOUTH: return wallSouth;
                case WEST: return wallWest;
                default: return true;
            }
        }

        void removeWall(Direction d) {
            switch (d) {
                case NORTH: wallNorth = false; break;
                case EAST: wallEast = false; break;
                case SOUTH: wallSouth = false; break;
                case WEST: wallWest = false; break;
                default: break;
            }
        }

        boolean anyWallRemoved() {
            return !(wallNorth && wallEast && wallSouth && wallWest);
        }
    }

    private static final class RoomState {
        Inhabitant inhabitant = Inhabitant.NONE;
        boolean treasure = false;
    }
}
