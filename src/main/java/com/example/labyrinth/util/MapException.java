package com.example.labyrinth.util;

/**
 * Thrown when a caller converts a failed {@link MapResult} into an exception.
 */
public class MapException extends RuntimeException {
    private final MapError error;

    public MapException(MapError error) {
        super(error.toString());
        this.error = error;
    }

    public MapError getError() { return error; }

    public MapError.Kind getKind() { return error.getKind(); }
}
