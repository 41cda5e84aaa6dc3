package com.example.labyrinth.util;

/**
 * A failed map operation: what went wrong and a message for the caller.
 */
public final class MapError {

    public enum Kind {
        /** A NONE direction, an absent Labyrinth, or a logical coordinate outside the Labyrinth. */
        INVALID_ARGUMENT,
        /** A map coordinate outside the map grid. */
        OUT_OF_BOUNDS,
        /** A Border-only operation on a Room cell, or the reverse. */
        SHAPE_MISMATCH
    }

    private final Kind kind;
    private final String message;

    public MapError(Kind kind, String message) {
        this.kind = kind;
        this.message = message == null ? "" : message;
    }

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
