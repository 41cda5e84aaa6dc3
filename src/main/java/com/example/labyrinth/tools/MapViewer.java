package com.example.labyrinth.tools;

import com.example.labyrinth.map.LabyrinthMap;
import com.example.labyrinth.map.MapStyle;
import com.example.labyrinth.model.Labyrinth;
import com.example.labyrinth.util.LabyrinthFormatException;
import com.example.labyrinth.util.LabyrinthLoader;
import com.example.labyrinth.util.MapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Prints the map of a labyrinth document.
 *
 * Usage: java -cp target/labyrinth-map-0.1.0-shaded.jar com.example.labyrinth.tools.MapViewer [file.yaml]
 *
 * If no file is given, the bundled sample labyrinth is shown.
 */
public class MapViewer {
    private static final Logger logger = LoggerFactory.getLogger(MapViewer.class);

    static final String SAMPLE = "labyrinths/sample.yaml";

    public static void main(String[] args) {
        try {
            Labyrinth labyrinth = args.length > 0
                ? LabyrinthLoader.loadFile(Paths.get(args[0]))
                : LabyrinthLoader.loadResource(SAMPLE);
            show(labyrinth, MapStyle.load());
        } catch (LabyrinthFormatException | MapException | IllegalArgumentException e) {
            logger.error("Unable to show labyrinth: {}", e.getMessage());
            System.exit(1);
        }
    }

    static void show(Labyrinth labyrinth, MapStyle style) {
        LabyrinthMap map = LabyrinthMap.create(labyrinth, labyrinth.getXSize(), labyrinth.getYSize(), style).orElseThrow();
        map.update().orElseThrow();
        map.display().orElseThrow();
    }
}
