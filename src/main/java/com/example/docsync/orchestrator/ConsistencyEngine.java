package com.example.docsync.orchestrator;

import com.example.docsync.analysis.EntityCoverage;
import com.example.docsync.analysis.GapAnalyzer;
import com.example.docsync.analysis.OperationalTriggerTable;
import com.example.docsync.analysis.ReportBuilder;
import com.example.docsync.analysis.ScoringPolicy;
import com.example.docsync.analysis.TextNormalizer;
import com.example.docsync.analysis.VectorSimilarityModel;
import com.example.docsync.extraction.CompositeEntityExtractor;
import com.example.docsync.extraction.ReferenceExtractor;
import com.example.docsync.extraction.ReferencePool;
import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.ConsistencyReport;
import com.example.docsync.model.GapSet;
import com.example.docsync.model.OperationalGap;
import com.example.docsync.model.SourceUnit;
import com.example.docsync.model.TermVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consistency scoring pipeline.
 * Pipeline:
 * 1. Entity extraction (per source unit, language-specific when possible)
 * 2. Reference pool (documentation + code comments)
 * 3. Term vectors and cosine similarity
 * 4. Gap partition and operational alignment
 * 5. Report assembly
 * <p>
 * Stateless apart from read-only configuration: one instance can serve concurrent callers.
 * Never throws: any failure is turned into a report carrying the error text.
 */
public class ConsistencyEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyEngine.class);

    private final CompositeEntityExtractor entityExtractor;
    private final ReferenceExtractor referenceExtractor;
    private final VectorSimilarityModel similarityModel;
    private final GapAnalyzer gapAnalyzer;
    private final ReportBuilder reportBuilder;

    public ConsistencyEngine(CompositeEntityExtractor entityExtractor,
                             ReferenceExtractor referenceExtractor,
                             VectorSimilarityModel similarityModel,
                             GapAnalyzer gapAnalyzer,
                             ReportBuilder reportBuilder) {
        this.entityExtractor = entityExtractor;
        this.referenceExtractor = referenceExtractor;
        this.similarityModel = similarityModel;
        this.gapAnalyzer = gapAnalyzer;
        this.reportBuilder = reportBuilder;
    }

    /** Engine with default stopwords, patterns, trigger table and score bands. */
    public static ConsistencyEngine withDefaults() {
        TextNormalizer normalizer = TextNormalizer.withDefaults();
        return new ConsistencyEngine(
                CompositeEntityExtractor.withDefaults(),
                new ReferenceExtractor(normalizer, false),
                new VectorSimilarityModel(normalizer),
                new GapAnalyzer(normalizer, OperationalTriggerTable.defaults()),
                new ReportBuilder(ScoringPolicy.defaults()));
    }

    /**
     * Analyzes already-aggregated code text against documentation text.
     *
     * @param codeText source code (may be null)
     * @param docText  documentation (may be null)
     * @return a fully populated report, never null
     */
    public ConsistencyReport analyze(String codeText, String docText) {
        return analyze(List.of(SourceUnit.of(codeText)), docText);
    }

    /**
     * Analyzes individual source files against documentation text. File names are kept
     * as entity origins and drive language-specific extraction.
     *
     * @param sources decoded source files
     * @param docText documentation (may be null)
     * @return a fully populated report, never null
     */
    public ConsistencyReport analyze(List<SourceUnit> sources, String docText) {
        try {
            return doAnalyze(sources != null ? sources : List.of(), docText != null ? docText : "");
        } catch (Exception | StackOverflowError e) {
            log.error("ConsistencyEngine: error during analysis", e);
            return ConsistencyReport.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ConsistencyReport doAnalyze(List<SourceUnit> sources, String docText) {
        String codeText = sources.stream().map(SourceUnit::text).collect(Collectors.joining("\n"));
        log.info("ConsistencyEngine: analyzing {} source unit(s), {} code chars, {} doc chars",
                sources.size(), codeText.length(), docText.length());

        if (codeText.isBlank()) {
            log.info("ConsistencyEngine: empty code input");
            return ConsistencyReport.noLogic();
        }

        // ── Step 1: entities ──
        Set<CodeEntity> entities = entityExtractor.extractAll(sources);
        if (entities.isEmpty()) {
            log.info("ConsistencyEngine: no entities detected, returning no-logic report");
            return ConsistencyReport.noLogic();
        }
        log.debug("ConsistencyEngine: {} entities extracted", entities.size());

        // ── Step 2: reference pool ──
        // per unit: an unterminated block in one file must not close in the next
        String comments = sources.stream()
                .map(unit -> referenceExtractor.extractComments(unit.text()))
                .filter(c -> !c.isEmpty())
                .collect(Collectors.joining(" "));
        ReferencePool pool = referenceExtractor.extractReferences(docText, comments);
        EntityCoverage coverage = EntityCoverage.of(entities, pool);

        // ── Step 3-4: vectors and gaps ──
        TermVector codeVector = similarityModel.vectorize(codeText);
        TermVector docVector = similarityModel.vectorize(docText);
        GapSet gaps = gapAnalyzer.analyzeGaps(codeVector.terms(), docVector.terms());

        if (docText.isBlank()) {
            return reportBuilder.buildMissingDocumentationReport(gaps, coverage);
        }

        double score = similarityModel.similarity(codeVector, docVector);
        List<OperationalGap> operationalGaps = gapAnalyzer.checkOperationalAlignment(codeText, docText);

        // ── Step 5: report ──
        ConsistencyReport report = reportBuilder.buildReport(score, gaps, operationalGaps, coverage);
        log.info("ConsistencyEngine: completed, {}/{} entities documented, {} operational gap(s)",
                coverage.documented().size(), coverage.total(), operationalGaps.size());
        return report;
    }
}
