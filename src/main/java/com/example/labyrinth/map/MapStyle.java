package com.example.labyrinth.map;

import com.example.labyrinth.model.Inhabitant;
import com.example.labyrinth.model.RoomBorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Glyphs used to draw a {@link LabyrinthMap}.
 * <p>
 * Room columns are three characters wide (inhabitant, gap, treasure) and so are the
 * horizontal Borders above and below them; vertical Borders and corners are one character.
 * The built-in defaults can be overridden by a {@code map-style.yaml} on the classpath:
 * <pre>
 * corner: "+"
 * horizontal: { wall: "---", open: "   ", exit: " E " }
 * vertical:   { wall: "|",   open: " ",   exit: "E" }
 * room:
 *   empty: " "
 *   treasure: "$"
 *   inhabitants: { person: "P", minotaur: "M", mirror: "R" }
 * </pre>
 */
public final class MapStyle {
    private static final Logger logger = LoggerFactory.getLogger(MapStyle.class);

    public static final String RESOURCE = "map-style.yaml";
    public static final int ROOM_WIDTH = 3;

    private final String corner;
    private final Map<RoomBorder, String> horizontal;
    private final Map<RoomBorder, String> vertical;
    private final String emptyRoom;
    private final String treasure;
    private final Map<Inhabitant, String> inhabitants;

    private MapStyle(String corner, Map<RoomBorder, String> horizontal, Map<RoomBorder, String> vertical,
                     String emptyRoom, String treasure, Map<Inhabitant, String> inhabitants) {
        this.corner = corner;
        this.horizontal = new EnumMap<>(horizontal);
        this.vertical = new EnumMap<>(vertical);
        this.emptyRoom = emptyRoom;
        this.treasure = treasure;
        this.inhabitants = new EnumMap<>(inhabitants);
        validate();
    }

    public static MapStyle defaults() {
        Map<RoomBorder, String> h = new EnumMap<>(RoomBorder.class);
        h.put(RoomBorder.WALL, "---");
        h.put(RoomBorder.ROOM, "   ");
        h.put(RoomBorder.EXIT, " E ");
        Map<RoomBorder, String> v = new EnumMap<>(RoomBorder.class);
        v.put(RoomBorder.WALL, "|");
        v.put(RoomBorder.ROOM, " ");
        v.put(RoomBorder.EXIT, "E");
        Map<Inhabitant, String> inh = new EnumMap<>(Inhabitant.class);
        inh.put(Inhabitant.NONE, " ");
        inh.put(Inhabitant.PERSON, "P");
        inh.put(Inhabitant.MINOTAUR, "M");
        inh.put(Inhabitant.MIRROR, "R");
        return new MapStyle("+", h, v, " ", "$", inh);
    }

    /**
     * Defaults overridden by {@value #RESOURCE} from the classpath, if present.
     * A missing or unreadable resource falls back to the defaults.
     */
    public static MapStyle load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream is = cl.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                logger.debug("No {} on classpath, using default map style", RESOURCE);
                return defaults();
            }
            return fromYaml(is);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage(), e);
            return defaults();
        }
    }

    /**
     * Defaults overridden by the keys present in a YAML document.
     * @throws IllegalArgumentException if the result would draw two border states alike
     */
    public static MapStyle fromYaml(InputStream in) {
        Object obj;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            obj = new Yaml().load(br);
        } catch (IOException | YAMLException e) {
            throw new IllegalArgumentException("Unable to read map style: " + e.getMessage(), e);
        }
        if (obj == null) {
            return defaults();
        }
        if (!(obj instanceof Map)) {
            throw new IllegalArgumentException("Map style must be a YAML mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> top = (Map<String, Object>) obj;
        return defaults().withOverrides(top);
    }

    MapStyle withOverrides(Map<String, Object> top) {
        String c = str(top.get("corner"), corner);
        Map<RoomBorder, String> h = new EnumMap<>(horizontal);
        Map<RoomBorder, String> v = new EnumMap<>(vertical);
        applyBorderOverrides(section(top, "horizontal"), h);
        applyBorderOverrides(section(top, "vertical"), v);

        Map<String, Object> room = section(top, "room");
        String empty = str(room.get("empty"), emptyRoom);
        String tr = str(room.get("treasure"), treasure);
        Map<Inhabitant, String> inh = new EnumMap<>(inhabitants);
        inh.put(Inhabitant.NONE, empty);
        for (Map.Entry<String, Object> e : section(room, "inhabitants").entrySet()) {
            Inhabitant i = Inhabitant.fromKey(e.getKey());
            if (i == null || i == Inhabitant.NONE) {
                logger.warn("Ignoring glyph for unknown inhabitant '{}'", e.getKey());
                continue;
            }
            inh.put(i, str(e.getValue(), inh.get(i)));
        }
        return new MapStyle(c, h, v, empty, tr, inh);
    }

    public String getCorner() { return corner; }

    /** Glyph of a Border between two vertically adjacent Rooms. */
    public String horizontal(RoomBorder state) { return horizontal.get(state); }

    /** Glyph of a Border between two horizontally adjacent Rooms. */
    public String vertical(RoomBorder state) { return vertical.get(state); }

    public String inhabitant(Inhabitant i) {
        return inhabitants.getOrDefault(i, emptyRoom);
    }

    /** Three-character drawing of a Room cell: inhabitant, gap, treasure. */
    public String room(Inhabitant i, boolean hasTreasure) {
        return inhabitant(i) + emptyRoom + (hasTreasure ? treasure : emptyRoom);
    }

    private void validate() {
        requireWidth("corner", corner, 1);
        requireWidth("room.empty", emptyRoom, 1);
        requireWidth("room.treasure", treasure, 1);
        for (RoomBorder b : RoomBorder.values()) {
            requireWidth("horizontal." + b.name().toLowerCase(), horizontal.get(b), ROOM_WIDTH);
            requireWidth("vertical." + b.name().toLowerCase(), vertical.get(b), 1);
        }
        for (Inhabitant i : Inhabitant.values()) {
            requireWidth("room.inhabitants." + i.getKey(), inhabitants.get(i), 1);
        }
        requireDistinct("horizontal", horizontal);
        requireDistinct("vertical", vertical);
        requireVisible("room.treasure", treasure);
        for (Inhabitant i : Inhabitant.values()) {
            if (i != Inhabitant.NONE) {
                requireVisible("room.inhabitants." + i.getKey(), inhabitants.get(i));
            }
        }
    }

    private void requireVisible(String key, String glyph) {
        if (glyph.equals(emptyRoom)) {
            throw new IllegalArgumentException("Map style '" + key + "' must differ from room.empty ('"
                + emptyRoom + "') or it cannot be told apart from an empty Room");
        }
    }

    private static void requireWidth(String key, String glyph, int width) {
        if (glyph == null || glyph.length() != width) {
            throw new IllegalArgumentException("Map style '" + key + "' must be exactly " + width
                + " character(s), got '" + glyph + "'");
        }
    }

    private static void requireDistinct(String key, Map<RoomBorder, String> glyphs) {
        Set<String> seen = new HashSet<>(glyphs.values());
        if (seen.size() != RoomBorder.values().length) {
            throw new IllegalArgumentException("Map style '" + key + "' must draw wall, open and exit differently: " + glyphs);
        }
    }

    private static void applyBorderOverrides(Map<String, Object> section, Map<RoomBorder, String> target) {
        target.put(RoomBorder.WALL, str(section.get("wall"), target.get(RoomBorder.WALL)));
        target.put(RoomBorder.ROOM, str(section.get("open"), target.get(RoomBorder.ROOM)));
        target.put(RoomBorder.EXIT, str(section.get("exit"), target.get(RoomBorder.EXIT)));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object o = parent.get(key);
        if (o instanceof Map) {
            return (Map<String, Object>) o;
        }
        return Map.of();
    }

    private static String str(Object o, String fallback) {
        return o == null ? fallback : o.toString();
    }
}
