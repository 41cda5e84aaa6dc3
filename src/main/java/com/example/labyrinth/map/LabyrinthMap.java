package com.example.labyrinth.map;

import com.example.labyrinth.model.Coordinate;
import com.example.labyrinth.model.Direction;
import com.example.labyrinth.model.Item;
import com.example.labyrinth.model.LabyrinthView;
import com.example.labyrinth.model.Room;
import com.example.labyrinth.model.RoomBorder;
import com.example.labyrinth.util.MapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A map of a Labyrinth, kept in sync with it by {@link #update()} and printed by {@link #display()}.
 * <p>
 * The map is a (2*xSize+1) x (2*ySize+1) grid. Labyrinth Room (x, y) sits at map (2x+1, 2y+1);
 * every position with an even coordinate is a Border (a wall segment or a corner).
 * Cells are stored row by row in one list.
 * <p>
 * The map reads the Labyrinth but never owns it: the Labyrinth must outlive the map.
 */
public class LabyrinthMap {
    private static final Logger logger = LoggerFactory.getLogger(LabyrinthMap.class);

    private final LabyrinthView labyrinth;
    private final int xSize;
    private final int ySize;
    private final int mapXSize;
    private final int mapYSize;
    private final List<LabyrinthMapCoordinate> cells;
    private final MapStyle style;

    private LabyrinthMap(LabyrinthView labyrinth, int xSize, int ySize, MapStyle style) {
        this.labyrinth = labyrinth;
        this.xSize = xSize;
        this.ySize = ySize;
        this.mapXSize = 2 * xSize + 1;
        this.mapYSize = 2 * ySize + 1;
        this.style = style;
        this.cells = new ArrayList<>(mapXSize * mapYSize);
        for (int y = 0; y < mapYSize; y++) {
            for (int x = 0; x < mapXSize; x++) {
                cells.add(new Coordinate(x, y).isRoomPosition()
                    ? LabyrinthMapCoordinate.room()
                    : LabyrinthMapCoordinate.border());
            }
        }
    }

    /** A map over the given Labyrinth drawn with the default glyphs. */
    public static MapResult<LabyrinthMap> create(LabyrinthView labyrinth, int xSize, int ySize) {
        return create(labyrinth, xSize, ySize, MapStyle.defaults());
    }

    /**
     * A map over the given Labyrinth.
     * @return INVALID_ARGUMENT if the Labyrinth is absent, or the sizes are not positive
     *         or do not match the Labyrinth's own dimensions
     */
    public static MapResult<LabyrinthMap> create(LabyrinthView labyrinth, int xSize, int ySize, MapStyle style) {
        if (labyrinth == null) {
            return MapResult.invalidArgument("LabyrinthMap was given a null Labyrinth.");
        }
        if (xSize <= 0 || ySize <= 0) {
            return MapResult.invalidArgument("LabyrinthMap dimensions must be positive, got " + xSize + "x" + ySize + ".");
        }
        try {
            Math.multiplyExact(Math.addExact(Math.multiplyExact(2, xSize), 1),
                Math.addExact(Math.multiplyExact(2, ySize), 1));
        } catch (ArithmeticException e) {
            return MapResult.invalidArgument("LabyrinthMap dimensions " + xSize + "x" + ySize + " are too large.");
        }
        if (xSize != labyrinth.getXSize() || ySize != labyrinth.getYSize()) {
            return MapResult.invalidArgument("LabyrinthMap dimensions " + xSize + "x" + ySize
                + " do not match the Labyrinth's " + labyrinth.getXSize() + "x" + labyrinth.getYSize() + ".");
        }
        return MapResult.success(new LabyrinthMap(labyrinth, xSize, ySize, style == null ? MapStyle.defaults() : style));
    }

    public int getXSize() { return xSize; }
    public int getYSize() { return ySize; }
    public int getMapXSize() { return mapXSize; }
    public int getMapYSize() { return mapYSize; }

    // ==================== Grid access ====================

    public boolean withinBoundsOfMap(Coordinate c) {
        return c != null && c.isWithin(mapXSize, mapYSize);
    }

    /**
     * Whether the map coordinate designates a Room (true) or a Border (false).
     * @return OUT_OF_BOUNDS if c is outside the map
     */
    public MapResult<Boolean> isRoom(Coordinate c) {
        return liveCell(c).map(LabyrinthMapCoordinate::isRoom);
    }

    /**
     * A copy of the cell at a map coordinate. Changing the copy does not change the map.
     * @return OUT_OF_BOUNDS if c is outside the map
     */
    public MapResult<LabyrinthMapCoordinate> cellAt(Coordinate c) {
        return liveCell(c).map(LabyrinthMapCoordinate::copy);
    }

    private MapResult<LabyrinthMapCoordinate> liveCell(Coordinate c) {
        if (!withinBoundsOfMap(c)) {
            return MapResult.outOfBounds("Coordinate " + c + " is outside of the " + mapXSize + "x" + mapYSize + " map.");
        }
        return MapResult.success(cells.get(c.y() * mapXSize + c.x()));
    }

    /** Independent copies of every cell, row by row. */
    public List<LabyrinthMapCoordinate> snapshot() {
        List<LabyrinthMapCoordinate> copy = new ArrayList<>(cells.size());
        for (LabyrinthMapCoordinate cell : cells) {
            copy.add(cell.copy());
        }
        return Collections.unmodifiableList(copy);
    }

    // ==================== Coordinate transforms ====================

    /**
     * Converts a Labyrinth Room coordinate to the same Room in the map.
     * @return INVALID_ARGUMENT if c is outside of the Labyrinth
     */
    public MapResult<Coordinate> labyrinthToMap(Coordinate c) {
        if (c == null || !c.isWithin(xSize, ySize)) {
            return MapResult.invalidArgument("Coordinate " + c + " is outside of the " + xSize + "x" + ySize + " Labyrinth.");
        }
        return MapResult.success(c.toMapSpace());
    }

    /**
     * Converts a map Room coordinate to the same Room in the Labyrinth.
     * @return OUT_OF_BOUNDS if c is outside of the map, SHAPE_MISMATCH if c designates a Border
     */
    public MapResult<Coordinate> mapToLabyrinth(Coordinate c) {
        if (!withinBoundsOfMap(c)) {
            return MapResult.outOfBounds("Coordinate " + c + " is outside of the " + mapXSize + "x" + mapYSize + " map.");
        }
        if (!c.isRoomPosition()) {
            return MapResult.shapeMismatch("Coordinate " + c + " designates a Border, which has no Labyrinth Room.");
        }
        return MapResult.success(c.toLabyrinthSpace());
    }

    // ==================== Update ====================

    /** Brings the map in line with the current state of every Room in the Labyrinth. */
    public MapResult<Void> update() {
        return update(labyrinth.roomCoordinates());
    }

    /**
     * Brings the map in line with the given Rooms, processed in the given order.
     * <p>
     * Room cells take the Room's inhabitant and treasure. Each side of the Room is folded into
     * the Border next to it, keeping whichever state is most open (exit, then open, then wall),
     * so neighbours that disagree about a shared Border always end up with the same result
     * regardless of order, and running the update again changes nothing.
     * Every coordinate is looked up before any cell is written.
     * @return INVALID_ARGUMENT if a coordinate is outside the Labyrinth
     */
    public MapResult<Void> update(Iterable<Coordinate> order) {
        if (order == null) {
            return MapResult.invalidArgument("update() was given no Rooms to process.");
        }
        List<Coordinate> coords = new ArrayList<>();
        List<Room> rooms = new ArrayList<>();
        for (Coordinate c : order) {
            MapResult<Room> room = labyrinth.roomAt(c);
            if (room.isFailure()) {
                return room.propagate();
            }
            coords.add(c);
            rooms.add(room.getValue());
        }

        for (int i = 0; i < coords.size(); i++) {
            applyRoom(coords.get(i).toMapSpace(), rooms.get(i));
        }
        logger.debug("Map updated from {} rooms", coords.size());
        return MapResult.ok();
    }

    private void applyRoom(Coordinate mapCoordinate, Room room) {
        LabyrinthMapCoordinate roomCell = liveCell(mapCoordinate).getValue();
        expect(roomCell.setInhabitant(room.getInhabitant()));
        expect(roomCell.setTreasure(room.getItem() == Item.TREASURE));

        for (Direction d : Direction.compass()) {
            RoomBorder state = room.directionCheck(d).getValue();
            LabyrinthMapCoordinate borderCell = liveCell(mapCoordinate.step(d).getValue()).getValue();
            switch (state) {
                case EXIT:
                    expect(borderCell.setExit(true));
                    expect(borderCell.removeWall(d.opposite()));
                    break;
                case ROOM:
                    expect(borderCell.removeWall(d.opposite()));
                    break;
                case WALL:
                default:
                    // Left as is: a wall never closes what a neighbour opened.
                    break;
            }
        }
    }

    private static void expect(MapResult<?> result) {
        if (result.isFailure()) {
            throw new IllegalStateException("Map grid is inconsistent: " + result.getError());
        }
    }

    // ==================== Display ====================

    /**
     * The drawing of one Border cell.
     * @return OUT_OF_BOUNDS if c is outside of the map, SHAPE_MISMATCH if c designates a Room
     */
    public MapResult<String> displayBorder(Coordinate c) {
        MapResult<LabyrinthMapCoordinate> cell = liveCell(c);
        if (cell.isFailure()) {
            return cell.propagate();
        }
        if (cell.getValue().isRoom()) {
            return MapResult.shapeMismatch("displayBorder() was given " + c + ", which designates a Room.");
        }
        boolean evenX = (c.x() & 1) == 0;
        boolean evenY = (c.y() & 1) == 0;
        if (evenX && evenY) {
            return MapResult.success(style.getCorner());
        }
        RoomBorder state = cell.getValue().classify().getValue();
        return MapResult.success(evenY ? style.horizontal(state) : style.vertical(state));
    }

    /** The drawing of one Room cell. */
    MapResult<String> displayRoom(Coordinate c) {
        MapResult<LabyrinthMapCoordinate> cell = liveCell(c);
        if (cell.isFailure()) {
            return cell.propagate();
        }
        LabyrinthMapCoordinate room = cell.getValue();
        MapResult<Boolean> treasure = room.hasTreasure();
        if (treasure.isFailure()) {
            return treasure.propagate();
        }
        return MapResult.success(style.room(room.hasInhabitant().getValue(), treasure.getValue()));
    }

    /** The map as text, one line per map row, top to bottom. */
    public MapResult<List<String>> render() {
        List<String> lines = new ArrayList<>(mapYSize);
        for (int y = 0; y < mapYSize; y++) {
            StringBuilder sb = new StringBuilder();
            for (int x = 0; x < mapXSize; x++) {
                Coordinate c = new Coordinate(x, y);
                MapResult<String> glyph = cells.get(y * mapXSize + x).isRoom() ? displayRoom(c) : displayBorder(c);
                if (glyph.isFailure()) {
                    return glyph.propagate();
                }
                sb.append(glyph.getValue());
            }
            lines.add(sb.toString());
        }
        return MapResult.success(lines);
    }

    /** Prints the map to standard output. */
    public MapResult<Void> display() {
        return display(System.out);
    }

    public MapResult<Void> display(PrintStream out) {
        MapResult<List<String>> lines = render();
        if (lines.isFailure()) {
            logger.warn("Unable to display map: {}", lines.getError());
            return lines.propagate();
        }
        for (String line : lines.getValue()) {
            out.println(line);
        }
        out.flush();
        return MapResult.ok();
    }
}
