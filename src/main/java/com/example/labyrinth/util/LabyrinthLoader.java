package com.example.labyrinth.util;

import com.example.labyrinth.model.Coordinate;
import com.example.labyrinth.model.Direction;
import com.example.labyrinth.model.Inhabitant;
import com.example.labyrinth.model.Item;
import com.example.labyrinth.model.Labyrinth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Labyrinth} from a YAML document.
 * <pre>
 * width: 3
 * height: 2
 * exit: { x: 0, y: 0, direction: north }
 * passages:
 *   - { x: 0, y: 0, direction: east }
 * inhabitants:
 *   - { x: 2, y: 1, inhabitant: minotaur }
 * items:
 *   - { x: 1, y: 1, item: treasure }
 * </pre>
 * Each passage takes down the wall between a Room and its neighbour in the given direction.
 */
public class LabyrinthLoader {
    private static final Logger logger = LoggerFactory.getLogger(LabyrinthLoader.class);

    /** Loads a labyrinth document from the classpath. */
    public static Labyrinth loadResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream is = cl.getResourceAsStream(resource)) {
            if (is == null) {
                throw new LabyrinthFormatException("Labyrinth resource not found: " + resource);
            }
            return load(is);
        } catch (IOException e) {
            throw new LabyrinthFormatException("Unable to read " + resource + ": " + e.getMessage(), e);
        }
    }

    public static Labyrinth loadFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new LabyrinthFormatException("Unable to read " + path + ": " + e.getMessage(), e);
        }
    }

    public static Labyrinth load(InputStream in) {
        Object obj;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            obj = new Yaml().load(br);
        } catch (IOException | YAMLException e) {
            throw new LabyrinthFormatException("Unable to parse labyrinth: " + e.getMessage(), e);
        }
        if (!(obj instanceof Map)) {
            throw new LabyrinthFormatException("Labyrinth document must be a YAML mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> top = (Map<String, Object>) obj;
        return build(top);
    }

    static Labyrinth build(Map<String, Object> top) {
        int width = requireInt(top, "width", "labyrinth");
        int height = requireInt(top, "height", "labyrinth");
        if (width <= 0 || height <= 0) {
            throw new LabyrinthFormatException("Labyrinth dimensions must be positive, got " + width + "x" + height);
        }
        Labyrinth labyrinth;
        try {
            labyrinth = new Labyrinth(width, height);
        } catch (IllegalArgumentException e) {
            throw new LabyrinthFormatException(e.getMessage(), e);
        }

        int passages = 0;
        for (Map<String, Object> entry : entries(top, "passages")) {
            String where = "passage " + entry;
            check(labyrinth.connect(coordinate(entry, where), direction(entry, where)), where);
            passages++;
        }

        Object exit = top.get("exit");
        if (exit instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> e = (Map<String, Object>) exit;
            String where = "exit " + e;
            check(labyrinth.setExit(coordinate(e, where), direction(e, where)), where);
        } else if (exit != null) {
            throw new LabyrinthFormatException("exit must be a mapping with x, y and direction");
        }

        for (Map<String, Object> entry : entries(top, "inhabitants")) {
            String where = "inhabitant " + entry;
            Inhabitant i = Inhabitant.fromKey(requireString(entry, "inhabitant", where));
            if (i == null) {
                throw new LabyrinthFormatException("Unknown inhabitant in " + where);
            }
            check(labyrinth.setInhabitant(coordinate(entry, where), i), where);
        }

        for (Map<String, Object> entry : entries(top, "items")) {
            String where = "item " + entry;
            Item item = Item.fromKey(requireString(entry, "item", where));
            if (item == null) {
                throw new LabyrinthFormatException("Unknown item in " + where);
            }
            check(labyrinth.setItem(coordinate(entry, where), item), where);
        }

        logger.info("Loaded {}x{} labyrinth with {} passages", width, height, passages);
        return labyrinth;
    }

    private static void check(MapResult<?> result, String where) {
        if (result.isFailure()) {
            throw new LabyrinthFormatException("Invalid " + where + ": " + result.getFailureMessage());
        }
    }

    private static Coordinate coordinate(Map<String, Object> entry, String where) {
        return new Coordinate(requireInt(entry, "x", where), requireInt(entry, "y", where));
    }

    private static Direction direction(Map<String, Object> entry, String where) {
        Direction d = Direction.fromKey(requireString(entry, "direction", where));
        if (d == null || d == Direction.NONE) {
            throw new LabyrinthFormatException("Invalid direction in " + where);
        }
        return d;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> entries(Map<String, Object> top, String key) {
        Object o = top.get(key);
        if (o == null) {
            return List.of();
        }
        if (!(o instanceof List)) {
            throw new LabyrinthFormatException(key + " must be a list");
        }
        for (Object e : (List<Object>) o) {
            if (!(e instanceof Map)) {
                throw new LabyrinthFormatException("Every entry of " + key + " must be a mapping, got " + e);
            }
        }
        return (List<Map<String, Object>>) o;
    }

    private static int requireInt(Map<String, Object> map, String key, String where) {
        Object val = map.get(key);
        if (val instanceof Integer i) {
            return i;
        }
        if (val instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        if (val instanceof Number) {
            throw new LabyrinthFormatException("'" + key + "' must be a whole number that fits an int, got " + val + " in " + where);
        }
        throw new LabyrinthFormatException("Missing or non-numeric '" + key + "' in " + where);
    }

    private static String requireString(Map<String, Object> map, String key, String where) {
        Object val = map.get(key);
        if (val == null) {
            throw new LabyrinthFormatException("Missing '" + key + "' in " + where);
        }
        return val.toString();
    }
}
