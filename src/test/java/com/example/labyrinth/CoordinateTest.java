package com.example.labyrinth;

import com.example.labyrinth.model.Coordinate;
import com.example.labyrinth.model.Direction;
import com.example.labyrinth.util.MapError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Coordinate Tests")
public class CoordinateTest {

    @ParameterizedTest
    @CsvSource({
        "0, 0, 1, 1",
        "1, 0, 3, 1",
        "0, 2, 1, 5",
        "4, 3, 9, 7"
    })
    @DisplayName("toMapSpace scales by two and offsets by one")
    void toMapSpace(int x, int y, int mx, int my) {
        Coordinate map = Coordinate.of(x, y).toMapSpace();
        assertEquals(Coordinate.of(mx, my), map);
        assertTrue(map.isRoomPosition());
        assertEquals(Coordinate.of(x, y), map.toLabyrinthSpace());
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0, false",
        "1, 0, false",
        "0, 1, false",
        "2, 1, false",
        "1, 1, true",
        "3, 5, true"
    })
    @DisplayName("only odd/odd positions are Room positions")
    void roomPositions(int x, int y, boolean room) {
        assertEquals(room, Coordinate.of(x, y).isRoomPosition());
    }

    @Test
    @DisplayName("isWithin is inclusive at zero and exclusive at the size")
    void bounds() {
        assertTrue(Coordinate.of(0, 0).isWithin(3, 2));
        assertTrue(Coordinate.of(2, 1).isWithin(3, 2));
        assertFalse(Coordinate.of(3, 1).isWithin(3, 2));
        assertFalse(Coordinate.of(2, 2).isWithin(3, 2));
        assertFalse(Coordinate.of(-1, 0).isWithin(3, 2));
    }

    @Test
    @DisplayName("step moves one cell, north being up")
    void step() {
        Coordinate c = Coordinate.of(3, 3);
        assertEquals(Coordinate.of(3, 2), c.step(Direction.NORTH).getValue());
        assertEquals(Coordinate.of(4, 3), c.step(Direction.EAST).getValue());
        assertEquals(Coordinate.of(3, 4), c.step(Direction.SOUTH).getValue());
        assertEquals(Coordinate.of(2, 3), c.step(Direction.WEST).getValue());
        assertEquals(MapError.Kind.INVALID_ARGUMENT, c.step(Direction.NONE).getErrorKind());
    }

    @Test
    @DisplayName("Direction.fromKey accepts names and single letters")
    void directionKeys() {
        assertEquals(Direction.NORTH, Direction.fromKey("North"));
        assertEquals(Direction.WEST, Direction.fromKey(" w "));
        assertEquals(Direction.NONE, Direction.fromKey("none"));
        assertNull(Direction.fromKey("up"));
        assertNull(Direction.fromKey(null));
        assertEquals(Direction.SOUTH, Direction.NORTH.opposite());
        assertEquals(Direction.NONE, Direction.NONE.opposite());
    }
}
