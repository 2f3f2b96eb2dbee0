package com.example.docsync.model;

/**
 * Qualitative band of a consistency score, ordered from worst to best.
 */
public enum AlignmentLabel {
    POOR_ALIGNMENT("Poor Alignment", "❌"),
    PARTIAL_ALIGNMENT("Partial Alignment", "⚠️"),
    HIGH_ALIGNMENT("High Alignment", "✅"),
    PRODUCTION_QUALITY("Production Quality", "🏆");

    private final String displayName;
    private final String icon;

    AlignmentLabel(String displayName, String icon) {
        this.displayName = displayName;
        this.icon = icon;
    }

    public String displayName() {
        return displayName;
    }

    public String icon() {
        return icon;
    }

    public boolean isBetterThan(AlignmentLabel other) {
        return ordinal() > other.ordinal();
    }
}
