package com.example.labyrinth.util;

/**
 * A labyrinth document that cannot be turned into a Labyrinth.
 */
public class LabyrinthFormatException extends RuntimeException {
    public LabyrinthFormatException(String message) {
        super(message);
    }

    public LabyrinthFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
