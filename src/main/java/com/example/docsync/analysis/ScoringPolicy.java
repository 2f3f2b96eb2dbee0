package com.example.docsync.analysis;

import com.example.docsync.model.AlignmentLabel;

/**
 * Label bands and suggestion bounds applied by {@link ReportBuilder}.
 * Bands are exclusive lower bounds: a score strictly above {@code productionQuality}
 * is PRODUCTION_QUALITY, and so on down to POOR_ALIGNMENT.
 *
 * @param productionQuality lower bound of PRODUCTION_QUALITY
 * @param highAlignment     lower bound of HIGH_ALIGNMENT
 * @param partialAlignment  lower bound of PARTIAL_ALIGNMENT
 * @param suggestionLimit   maximum number of per-entity and per-term items listed in suggestions
 */
public record ScoringPolicy(
        double productionQuality,
        double highAlignment,
        double partialAlignment,
        int suggestionLimit
) {
    public ScoringPolicy {
        if (!(0.0 <= partialAlignment && partialAlignment < highAlignment
                && highAlignment < productionQuality && productionQuality <= 1.0)) {
            throw new IllegalArgumentException(
                    "Score bands must satisfy 0 <= partial < high < production <= 1, got %s / %s / %s"
                            .formatted(partialAlignment, highAlignment, productionQuality));
        }
        if (suggestionLimit < 1) {
            throw new IllegalArgumentException("suggestionLimit must be positive, got " + suggestionLimit);
        }
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(0.85, 0.65, 0.40, 5);
    }

    public AlignmentLabel labelFor(double score) {
        if (score > productionQuality) return AlignmentLabel.PRODUCTION_QUALITY;
        if (score > highAlignment) return AlignmentLabel.HIGH_ALIGNMENT;
        if (score > partialAlignment) return AlignmentLabel.PARTIAL_ALIGNMENT;
        return AlignmentLabel.POOR_ALIGNMENT;
    }
}
