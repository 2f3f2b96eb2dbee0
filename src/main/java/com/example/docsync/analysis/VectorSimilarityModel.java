package com.example.docsync.analysis;

import com.example.docsync.model.TermVector;

/**
 * Vector-space similarity between two corpora.
 * <p>
 * Term weights are sublinear ({@code 1 + ln(tf)}) so repetition does not dominate:
 * the score measures vocabulary breadth overlap. No IDF weighting is applied.
 * The raw cosine is returned; display scaling belongs to {@link ReportBuilder}.
 */
public final class VectorSimilarityModel {

    private final TextNormalizer normalizer;

    public VectorSimilarityModel(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public TermVector vectorize(String corpus) {
        return TermVector.of(normalizer.normalize(corpus));
    }

    public double similarity(String corpusA, String corpusB) {
        return similarity(vectorize(corpusA), vectorize(corpusB));
    }

    /**
     * Cosine similarity of two term vectors.
     *
     * @return value in [0,1]; 0.0 when either vector is empty
     */
    public double similarity(TermVector a, TermVector b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.equals(b)) return 1.0;

        double denominator = a.norm() * b.norm();
        if (denominator == 0.0) return 0.0;

        // both key sets are sorted, so the shared terms are summed in the same order either way
        double dot = 0.0;
        for (String term : a.terms()) {
            double wb = b.weight(term);
            if (wb > 0.0) {
                dot += a.weight(term) * wb;
            }
        }
        return Math.max(0.0, Math.min(1.0, dot / denominator));
    }
}
