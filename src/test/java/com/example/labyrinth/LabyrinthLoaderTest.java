package com.example.labyrinth;

import com.example.labyrinth.map.LabyrinthMap;
import com.example.labyrinth.model.Coordinate;
import com.example.labyrinth.model.Direction;
import com.example.labyrinth.model.Inhabitant;
import com.example.labyrinth.model.Item;
import com.example.labyrinth.model.Labyrinth;
import com.example.labyrinth.model.RoomBorder;
import com.example.labyrinth.util.LabyrinthFormatException;
import com.example.labyrinth.util.LabyrinthLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LabyrinthLoader Tests")
public class LabyrinthLoaderTest {

    private static Labyrinth parse(String yaml) {
        return LabyrinthLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("loads dimensions, passages, exit and contents")
    void loadsCorridor() {
        Labyrinth l = LabyrinthLoader.loadResource("labyrinths/corridor.yaml");

        assertEquals(2, l.getXSize());
        assertEquals(1, l.getYSize());
        assertEquals(Optional.of(Coordinate.of(0, 0)), l.getExitRoom());
        assertEquals(RoomBorder.EXIT, l.roomAt(Coordinate.of(0, 0)).getValue().directionCheck(Direction.WEST).getValue());
        assertEquals(RoomBorder.ROOM, l.roomAt(Coordinate.of(1, 0)).getValue().directionCheck(Direction.WEST).getValue());
        assertEquals(Inhabitant.PERSON, l.roomAt(Coordinate.of(0, 0)).getValue().getInhabitant());
        assertEquals(Item.TREASURE, l.roomAt(Coordinate.of(1, 0)).getValue().getItem());
    }

    @Test
    @DisplayName("the bundled sample renders")
    void sampleRenders() {
        Labyrinth l = LabyrinthLoader.loadResource("labyrinths/sample.yaml");
        LabyrinthMap map = LabyrinthMap.create(l, l.getXSize(), l.getYSize()).getValue();
        assertTrue(map.update().isSuccess());

        List<String> lines = map.render().getValue();
        assertEquals(2 * l.getYSize() + 1, lines.size());
        assertTrue(lines.get(1).endsWith("E"), lines.get(1));
    }

    @Test
    @DisplayName("a passage through the outer wall is rejected with its entry named")
    void rejectsPassageOutOfLabyrinth() {
        LabyrinthFormatException e = assertThrows(LabyrinthFormatException.class,
            () -> LabyrinthLoader.loadResource("labyrinths/bad-passage.yaml"));
        assertTrue(e.getMessage().contains("passage"), e.getMessage());
    }

    @Test
    @DisplayName("fractional coordinates are refused rather than truncated")
    void rejectsFractionalCoordinate() {
        LabyrinthFormatException e = assertThrows(LabyrinthFormatException.class,
            () -> parse("width: 2\nheight: 2\nitems:\n  - { x: 1.5, y: 0, item: treasure }"));
        assertTrue(e.getMessage().contains("whole number"), e.getMessage());
    }

    @Test
    @DisplayName("a missing resource is reported")
    void missingResource() {
        assertThrows(LabyrinthFormatException.class, () -> LabyrinthLoader.loadResource("labyrinths/nope.yaml"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "- just a list",
        "width: 2",
        "width: 0\nheight: 2",
        "width: 2\nheight: 2\npassages: 3",
        "width: 2\nheight: 2\npassages:\n  - { x: 0, y: 0, direction: up }",
        "width: 2\nheight: 2\ninhabitants:\n  - { x: 0, y: 0, inhabitant: dragon }",
        "width: 2\nheight: 2\nitems:\n  - { x: 5, y: 0, item: treasure }",
        "width: 2\nheight: 2\nexit: { x: 0, y: 0, direction: east }",
        "width: [unclosed",
        "width: 2.9\nheight: 2",
        "width: 2\nheight: 4294967298",
        "width: 2\nheight: 99999999999999999999",
        "width: 65536\nheight: 65537"
    })
    @DisplayName("malformed documents raise LabyrinthFormatException")
    void rejectsMalformed(String yaml) {
        assertThrows(LabyrinthFormatException.class, () -> parse(yaml));
    }
}
