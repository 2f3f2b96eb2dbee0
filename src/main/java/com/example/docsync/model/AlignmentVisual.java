package com.example.docsync.model;

/**
 * Counts backing the alignment chart of a rendering layer.
 */
public record AlignmentVisual(int common, int gapInDoc, int gapInCode) {

    public static AlignmentVisual of(GapSet gaps) {
        return new AlignmentVisual(gaps.common().size(), gaps.missingInDoc().size(), gaps.missingInCode().size());
    }
}
