package com.example.docsync.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable term-frequency vector of one corpus.
 * Terms are kept sorted so that every traversal visits them in the same order.
 */
public final class TermVector {

    private static final TermVector EMPTY = new TermVector(new TreeMap<>());

    private final SortedMap<String, Integer> frequencies;
    private final double norm;

    private TermVector(SortedMap<String, Integer> frequencies) {
        this.frequencies = Collections.unmodifiableSortedMap(frequencies);
        double sumOfSquares = 0.0;
        for (String term : this.frequencies.keySet()) {
            double w = weight(term);
            sumOfSquares += w * w;
        }
        this.norm = Math.sqrt(sumOfSquares);
    }

    public static TermVector of(Collection<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return EMPTY;
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return new TermVector(counts);
    }

    public static TermVector empty() {
        return EMPTY;
    }

    /** Raw occurrence count, 0 when the term is absent. */
    public int frequency(String term) {
        return frequencies.getOrDefault(term, 0);
    }

    /** Sublinear weight {@code 1 + ln(tf)}, 0 when the term is absent. */
    public double weight(String term) {
        int tf = frequency(term);
        return tf == 0 ? 0.0 : 1.0 + Math.log(tf);
    }

    public double norm() {
        return norm;
    }

    public Set<String> terms() {
        return frequencies.keySet();
    }

    public Map<String, Integer> frequencies() {
        return frequencies;
    }

    public boolean isEmpty() {
        return frequencies.isEmpty();
    }

    public int size() {
        return frequencies.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermVector other)) return false;
        return frequencies.equals(other.frequencies);
    }

    @Override
    public int hashCode() {
        return frequencies.hashCode();
    }

    @Override
    public String toString() {
        return "TermVector" + frequencies;
    }
}
