package com.example.docsync.model;

/**
 * Pass/fail decision of the CI gate.
 *
 * @param passed    true when the score reaches the threshold
 * @param threshold minimum score required
 * @param score     score of the evaluated report
 * @param label     label of the evaluated report
 * @param message   one-line verdict for build logs
 * @param report    the evaluated report
 */
public record GateVerdict(
        boolean passed,
        double threshold,
        double score,
        AlignmentLabel label,
        String message,
        ConsistencyReport report
) {}
