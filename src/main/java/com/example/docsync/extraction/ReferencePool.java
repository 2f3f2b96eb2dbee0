package com.example.docsync.extraction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercased documentation pool (documentation text plus code comments) used to decide
 * whether an entity is referenced.
 * <p>
 * By default a name is referenced when it occurs anywhere in the pool as a substring, so
 * {@code get} is found inside "target". With word-boundary matching enabled the name must
 * stand on its own, delimited by anything but letters, digits and underscores.
 */
public final class ReferencePool {

    private final String text;
    private final Set<String> tokens;
    private final boolean wordBoundary;

    ReferencePool(String text, List<String> tokens, boolean wordBoundary) {
        this.text = text;
        this.tokens = Collections.unmodifiableSet(new LinkedHashSet<>(tokens));
        this.wordBoundary = wordBoundary;
    }

    public boolean mentions(String name) {
        if (name == null || name.isBlank()) return false;
        String needle = name.toLowerCase(Locale.ROOT);
        if (!wordBoundary) {
            return text.contains(needle);
        }
        return Pattern.compile("(?<![\\p{Alnum}_])" + Pattern.quote(needle) + "(?![\\p{Alnum}_])")
                .matcher(text)
                .find();
    }

    /** Normalized tokens of the whole pool. */
    public Set<String> tokens() {
        return tokens;
    }

    public String text() {
        return text;
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    public boolean wordBoundary() {
        return wordBoundary;
    }
}
