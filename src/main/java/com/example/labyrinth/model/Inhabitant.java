package com.example.labyrinth.model;

/**
 * Occupants a Room may hold. Opaque to the map beyond which one is present.
 */
public enum Inhabitant {
    NONE("none", "Nobody"),
    PERSON("person", "Person"),
    MINOTAUR("minotaur", "Minotaur"),
    MIRROR("mirror", "Mirror");

    private final String key;
    private final String displayName;

    Inhabitant(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static Inhabitant fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Inhabitant i : values()) if (i.key.equals(k)) return i;
        return null;
    }
}
