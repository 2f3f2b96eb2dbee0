package com.example.docsync.model;

import java.util.List;

/**
 * Result of one consistency analysis between a code corpus and a documentation corpus.
 *
 * @param score                 cosine similarity of the two vocabularies (0.0-1.0, 4 decimals)
 * @param percentage            score as an integer percentage (0-100)
 * @param label                 qualitative band of the score
 * @param icon                  icon token of the label
 * @param summary               one-line entity coverage summary
 * @param stats                 issue/synced counters and categorized breakdown
 * @param suggestions           ordered actionable suggestions
 * @param visual                chart counts (common / gap in doc / gap in code)
 * @param gaps                  vocabulary partition
 * @param operationalGaps       code operations the documentation never mentions
 * @param documentedEntities    entity names referenced by the documentation or comments
 * @param undocumentedEntities  entity names nobody mentions
 */
public record ConsistencyReport(
        double score,
        int percentage,
        AlignmentLabel label,
        String icon,
        String summary,
        ReportStats stats,
        List<String> suggestions,
        AlignmentVisual visual,
        GapSet gaps,
        List<OperationalGap> operationalGaps,
        List<String> documentedEntities,
        List<String> undocumentedEntities
) {

    public static final String NO_LOGIC_SUMMARY = "No code logic detected.";
    public static final String NO_LOGIC_SUGGESTION =
            "Provide valid source code: no functions, classes, methods or configuration keys were detected.";
    public static final String FAILED_SUMMARY = "Analysis failed.";

    public ConsistencyReport {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        operationalGaps = operationalGaps != null ? List.copyOf(operationalGaps) : List.of();
        documentedEntities = documentedEntities != null ? List.copyOf(documentedEntities) : List.of();
        undocumentedEntities = undocumentedEntities != null ? List.copyOf(undocumentedEntities) : List.of();
        if (stats == null) stats = ReportStats.empty();
        if (gaps == null) gaps = GapSet.empty();
        if (visual == null) visual = AlignmentVisual.of(gaps);
    }

    /** Degenerate report returned when the code side yields no entity at all. */
    public static ConsistencyReport noLogic() {
        return degenerate(NO_LOGIC_SUMMARY, NO_LOGIC_SUGGESTION);
    }

    /** Report carrying the error text of an analysis that could not complete. */
    public static ConsistencyReport failed(String error) {
        String detail = error != null && !error.isBlank() ? error : "Unknown error";
        return degenerate(FAILED_SUMMARY, "Analysis error: " + detail);
    }

    private static ConsistencyReport degenerate(String summary, String suggestion) {
        AlignmentLabel label = AlignmentLabel.POOR_ALIGNMENT;
        return new ConsistencyReport(0.0, 0, label, label.icon(), summary,
                ReportStats.empty(), List.of(suggestion), new AlignmentVisual(0, 0, 0),
                GapSet.empty(), List.of(), List.of(), List.of());
    }
}
