package com.example.docsync.analysis;

import com.example.docsync.model.AlignmentLabel;
import com.example.docsync.model.AlignmentVisual;
import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.ConsistencyReport;
import com.example.docsync.model.EntityKind;
import com.example.docsync.model.GapSet;
import com.example.docsync.model.OperationalGap;
import com.example.docsync.model.ReportStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles the final {@link ConsistencyReport} from the score, the gap sets and the entity coverage.
 * <p>
 * Suggestions are deterministic and ordered:
 * <ol>
 *   <li>operational gaps</li>
 *   <li>one line per undocumented entity, bounded by {@link ScoringPolicy#suggestionLimit()}</li>
 *   <li>vocabulary hints (no shared vocabulary, zombie documentation terms, undocumented code terms)</li>
 * </ol>
 * Inputs are never modified.
 */
public final class ReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReportBuilder.class);

    /** Number of missing entities quoted verbatim in the summary. */
    private static final int SUMMARY_SAMPLE = 3;

    private final ScoringPolicy policy;

    public ReportBuilder(ScoringPolicy policy) {
        this.policy = policy;
    }

    public ConsistencyReport buildReport(double score, GapSet gaps, List<OperationalGap> operationalGaps) {
        return buildReport(score, gaps, operationalGaps, EntityCoverage.none());
    }

    public ConsistencyReport buildReport(double score, GapSet gaps, List<OperationalGap> operationalGaps,
                                         EntityCoverage coverage) {
        double rounded = round(score);
        AlignmentLabel label = policy.labelFor(rounded);

        List<String> suggestions = new ArrayList<>();
        operationalGaps.forEach(gap -> suggestions.add(gap.message()));
        suggestions.addAll(entitySuggestions(coverage.undocumented()));
        suggestions.addAll(vocabularySuggestions(gaps));
        if (suggestions.isEmpty()) {
            suggestions.add("Documentation is in sync with the code.");
        }

        ConsistencyReport report = new ConsistencyReport(
                rounded,
                percentage(rounded),
                label,
                label.icon(),
                summarize(coverage),
                stats(gaps, operationalGaps, coverage),
                suggestions,
                AlignmentVisual.of(gaps),
                gaps,
                operationalGaps,
                names(coverage.documented()),
                names(coverage.undocumented())
        );

        log.info("ReportBuilder: score {} ({}), {} issue(s), {} synced, {} suggestion(s)",
                rounded, label, report.stats().issueCount(), report.stats().syncedCount(), suggestions.size());
        return report;
    }

    /**
     * Report for code analyzed against empty documentation: zero score, but gaps and
     * undocumented entities are still listed.
     */
    public ConsistencyReport buildMissingDocumentationReport(GapSet gaps, EntityCoverage coverage) {
        AlignmentLabel label = AlignmentLabel.POOR_ALIGNMENT;
        String suggestion = "Provide documentation text: %d code entit%s (%s) ha%s nothing to be compared against."
                .formatted(coverage.total(), coverage.total() == 1 ? "y" : "ies",
                        sample(coverage.undocumented().isEmpty() ? coverage.documented() : coverage.undocumented()),
                        coverage.total() == 1 ? "s" : "ve");

        log.info("ReportBuilder: no documentation supplied, {} entities unchecked", coverage.total());
        return new ConsistencyReport(
                0.0,
                0,
                label,
                label.icon(),
                "NO DOCUMENTATION: %d code entities were found but no documentation was supplied."
                        .formatted(coverage.total()),
                stats(gaps, List.of(), coverage),
                List.of(suggestion),
                AlignmentVisual.of(gaps),
                gaps,
                List.of(),
                names(coverage.documented()),
                names(coverage.undocumented())
        );
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private List<String> entitySuggestions(List<CodeEntity> undocumented) {
        int limit = policy.suggestionLimit();
        List<String> lines = new ArrayList<>();
        for (CodeEntity entity : undocumented.subList(0, Math.min(limit, undocumented.size()))) {
            lines.add("Document %s '%s'%s.".formatted(
                    entity.kind().displayName(),
                    entity.name(),
                    entity.origin() != null ? " (" + entity.origin() + ")" : ""));
        }
        if (undocumented.size() > limit) {
            lines.add("... and %d more undocumented entities.".formatted(undocumented.size() - limit));
        }
        return lines;
    }

    private List<String> vocabularySuggestions(GapSet gaps) {
        List<String> lines = new ArrayList<>();
        if (gaps.common().isEmpty()) {
            lines.add("CRITICAL: No common vocabulary found. Rename identifiers or rewrite the documentation "
                    + "using the domain terms of the code.");
        }
        if (!gaps.missingInCode().isEmpty()) {
            lines.add("Consider using these doc terms in your code, or remove them if stale: "
                    + top(gaps.missingInCode()));
        }
        if (!gaps.missingInDoc().isEmpty()) {
            lines.add("Document these code terms: " + top(gaps.missingInDoc()));
        }
        return lines;
    }

    private String summarize(EntityCoverage coverage) {
        if (coverage.total() == 0) {
            return "Vocabulary-only comparison: no code entities were supplied.";
        }
        if (coverage.documented().isEmpty()) {
            return "CRITICAL GAP: detected %d logic entities, but NONE are described.".formatted(coverage.total());
        }
        if (!coverage.undocumented().isEmpty()) {
            return "DOCUMENTATION DEBT: %d of %d entities are missing coverage. Missing: %s"
                    .formatted(coverage.undocumented().size(), coverage.total(), sample(coverage.undocumented()));
        }
        return "PERFECT ALIGNMENT: every code entity is explained in the documentation context.";
    }

    private ReportStats stats(GapSet gaps, List<OperationalGap> operationalGaps, EntityCoverage coverage) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("entities", coverage.total());
        breakdown.put("functions", (int) coverage.count(EntityKind.FUNCTION));
        breakdown.put("classes", (int) coverage.count(EntityKind.CLASS));
        breakdown.put("methods", (int) coverage.count(EntityKind.METHOD));
        breakdown.put("configKeys", (int) coverage.count(EntityKind.CONFIG_KEY));
        breakdown.put("documentedEntities", coverage.documented().size());
        breakdown.put("undocumentedEntities", coverage.undocumented().size());
        breakdown.put("entityCoveragePercent", coverage.coveragePercent());
        breakdown.put("zombieTerms", gaps.missingInCode().size());
        breakdown.put("operationalGaps", operationalGaps.size());
        return new ReportStats(gaps.missingInDoc().size(), gaps.common().size(), breakdown);
    }

    private String top(Collection<String> terms) {
        return terms.stream().limit(policy.suggestionLimit()).collect(Collectors.joining(", "));
    }

    private static String sample(List<CodeEntity> entities) {
        return entities.stream().limit(SUMMARY_SAMPLE).map(CodeEntity::name).collect(Collectors.joining(", "));
    }

    private static List<String> names(List<CodeEntity> entities) {
        return entities.stream().map(CodeEntity::name).toList();
    }

    private static double round(double score) {
        if (Double.isNaN(score)) return 0.0;
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return Math.round(clamped * 10_000.0) / 10_000.0;
    }

    private static int percentage(double score) {
        return (int) Math.round(score * 100.0);
    }
}
