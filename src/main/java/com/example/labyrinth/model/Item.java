package com.example.labyrinth.model;

public enum Item {
    NONE("none"),
    TREASURE("treasure");

    private final String key;

    Item(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static Item fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Item i : values()) if (i.key.equals(k)) return i;
        return null;
    }
}
