package com.example.labyrinth;

import com.example.labyrinth.map.LabyrinthMap;
import com.example.labyrinth.map.MapStyle;
import com.example.labyrinth.model.Coordinate;
import com.example.labyrinth.model.Direction;
import com.example.labyrinth.model.Inhabitant;
import com.example.labyrinth.model.Labyrinth;
import com.example.labyrinth.model.RoomBorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapStyle Tests")
public class MapStyleTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("defaults draw the three border states differently")
    void defaultsAreDistinct() {
        MapStyle style = MapStyle.defaults();
        assertNotEquals(style.horizontal(RoomBorder.WALL), style.horizontal(RoomBorder.ROOM));
        assertNotEquals(style.horizontal(RoomBorder.WALL), style.horizontal(RoomBorder.EXIT));
        assertNotEquals(style.vertical(RoomBorder.ROOM), style.vertical(RoomBorder.EXIT));
        assertEquals("P  ", style.room(Inhabitant.PERSON, false));
        assertEquals("  $", style.room(Inhabitant.NONE, true));
        assertEquals("M $", style.room(Inhabitant.MINOTAUR, true));
    }

    @Test
    @DisplayName("the bundled map-style.yaml loads")
    void bundledStyleLoads() {
        MapStyle style = MapStyle.load();
        assertEquals("+", style.getCorner());
        assertEquals("R", style.inhabitant(Inhabitant.MIRROR));
    }

    @Test
    @DisplayName("keys present in YAML override the defaults, the rest are kept")
    void partialOverride() {
        MapStyle style = MapStyle.fromYaml(yaml(
            "corner: \"#\"\n"
            + "vertical: { exit: \">\" }\n"
            + "room:\n"
            + "  inhabitants: { minotaur: \"T\" }\n"));

        assertEquals("#", style.getCorner());
        assertEquals(">", style.vertical(RoomBorder.EXIT));
        assertEquals("|", style.vertical(RoomBorder.WALL));
        assertEquals("T", style.inhabitant(Inhabitant.MINOTAUR));
        assertEquals("P", style.inhabitant(Inhabitant.PERSON));
    }

    @Test
    @DisplayName("an empty document gives the defaults")
    void emptyDocument() {
        MapStyle style = MapStyle.fromYaml(yaml(""));
        assertEquals(MapStyle.defaults().horizontal(RoomBorder.EXIT), style.horizontal(RoomBorder.EXIT));
    }

    @Test
    @DisplayName("a style that draws open and exit alike is rejected")
    void collidingGlyphsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("vertical: { open: \"E\" }\n")));
    }

    @Test
    @DisplayName("treasure or inhabitant glyphs that look like an empty Room are rejected")
    void invisibleRoomContentsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("room: { treasure: \" \" }\n")));
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("room:\n  inhabitants: { person: \" \" }\n")));
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("room:\n  empty: \".\"\n  inhabitants: { minotaur: \".\" }\n")));
        MapStyle dotted = MapStyle.fromYaml(yaml("room: { empty: \".\" }\n"));
        assertEquals("...", dotted.room(Inhabitant.NONE, false));
        assertEquals("P.$", dotted.room(Inhabitant.PERSON, true));
    }

    @Test
    @DisplayName("glyphs of the wrong width are rejected")
    void wrongWidthRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("horizontal: { wall: \"-\" }\n")));
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("corner: \"++\"\n")));
        assertThrows(IllegalArgumentException.class,
            () -> MapStyle.fromYaml(yaml("- not a mapping\n")));
    }

    @Test
    @DisplayName("a map draws with the style it was created with")
    void mapUsesStyle() {
        MapStyle style = MapStyle.fromYaml(yaml("corner: \"o\"\nhorizontal: { exit: \"^^^\" }\n"));
        Labyrinth l = new Labyrinth(1, 1);
        l.setExit(Coordinate.of(0, 0), Direction.NORTH);
        LabyrinthMap map = LabyrinthMap.create(l, 1, 1, style).getValue();
        map.update();

        assertEquals(List.of("o^^^o", "|   |", "o---o"), map.render().getValue());
    }
}
