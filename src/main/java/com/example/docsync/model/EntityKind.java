package com.example.docsync.model;

/**
 * Kind of named construct found in source code.
 */
public enum EntityKind {
    FUNCTION("function"),
    CLASS("class"),
    METHOD("method"),
    CONFIG_KEY("config key");

    private final String displayName;

    EntityKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
