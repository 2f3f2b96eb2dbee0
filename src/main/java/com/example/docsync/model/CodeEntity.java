package com.example.docsync.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A named code construct extracted from source text.
 *
 * @param name   identifier as it appears in the code
 * @param kind   construct kind
 * @param origin file the entity was found in, or null when the code came in as a single string
 */
public record CodeEntity(
        String name,
        EntityKind kind,
        String origin
) {
    public CodeEntity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public CodeEntity(String name, EntityKind kind) {
        this(name, kind, null);
    }

    /** Lowercased name used for all case-insensitive comparisons. */
    public String normalizedName() {
        return name.toLowerCase(Locale.ROOT);
    }
}
