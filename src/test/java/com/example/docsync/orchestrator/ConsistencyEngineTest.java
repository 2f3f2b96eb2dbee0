package com.example.docsync.orchestrator;

import com.example.docsync.analysis.GapAnalyzer;
import com.example.docsync.analysis.OperationalTriggerTable;
import com.example.docsync.analysis.ReportBuilder;
import com.example.docsync.analysis.ScoringPolicy;
import com.example.docsync.analysis.TextNormalizer;
import com.example.docsync.analysis.VectorSimilarityModel;
import com.example.docsync.extraction.CompositeEntityExtractor;
import com.example.docsync.extraction.EntityExtractor;
import com.example.docsync.extraction.LexicalEntityExtractor;
import com.example.docsync.extraction.ReferenceExtractor;
import com.example.docsync.model.AlignmentLabel;
import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.ConsistencyReport;
import com.example.docsync.model.OperationalGap;
import com.example.docsync.model.SourceUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyEngineTest {

    private static final String ADD_CODE = "def add(a, b): return a + b";

    private final ConsistencyEngine engine = ConsistencyEngine.withDefaults();

    private static ConsistencyEngine engine(CompositeEntityExtractor extractor, boolean wordBoundary) {
        TextNormalizer normalizer = TextNormalizer.withDefaults();
        return new ConsistencyEngine(
                extractor,
                new ReferenceExtractor(normalizer, wordBoundary),
                new VectorSimilarityModel(normalizer),
                new GapAnalyzer(normalizer, OperationalTriggerTable.defaults()),
                new ReportBuilder(ScoringPolicy.defaults()));
    }

    @Nested
    class Scenarios {

        @Test
        @DisplayName("Entity named inside a longer doc word counts as documented with substring matching")
        void shouldDocumentEntityBySubstring() {
            ConsistencyReport report = engine.analyze(ADD_CODE, "This function adds two numbers.");

            assertThat(report.documentedEntities()).containsExactly("add");
            assertThat(report.undocumentedEntities()).isEmpty();
            assertThat(report.score()).isZero();
            assertThat(report.gaps().missingInDoc()).containsExactly("add");
            assertThat(report.gaps().missingInCode()).containsExactly("adds", "numbers", "two");
            assertThat(report.suggestions()).last().isEqualTo("Document these code terms: add");
        }

        @Test
        void shouldReportEntityAsUndocumentedWithWordBoundaryMatching() {
            ConsistencyReport report = engine(CompositeEntityExtractor.withDefaults(), true)
                    .analyze(ADD_CODE, "This function adds two numbers.");

            assertThat(report.undocumentedEntities()).containsExactly("add");
            assertThat(report.summary()).isEqualTo("CRITICAL GAP: detected 1 logic entities, but NONE are described.");
            assertThat(report.suggestions()).contains("Document function 'add'.");
        }

        @Test
        void shouldScoreZeroWithoutDocumentation() {
            ConsistencyReport report = engine.analyze("class PaymentGateway: ...", "");

            assertThat(report.score()).isZero();
            assertThat(report.label()).isEqualTo(AlignmentLabel.POOR_ALIGNMENT);
            assertThat(report.undocumentedEntities()).containsExactly("PaymentGateway");
            assertThat(report.gaps().missingInDoc()).containsExactly("paymentgateway");
            assertThat(report.summary()).startsWith("NO DOCUMENTATION");
            assertThat(engine.analyze("class PaymentGateway: ...", null)).isEqualTo(report);
        }

        @Test
        void shouldScorePerfectlyForIdenticalInputs() {
            ConsistencyReport report = engine.analyze(ADD_CODE, ADD_CODE);

            assertThat(report.score()).isEqualTo(1.0);
            assertThat(report.percentage()).isEqualTo(100);
            assertThat(report.label()).isEqualTo(AlignmentLabel.PRODUCTION_QUALITY);
            assertThat(report.gaps().missingInDoc()).isEmpty();
            assertThat(report.gaps().missingInCode()).isEmpty();
            assertThat(report.suggestions()).containsExactly("Documentation is in sync with the code.");
        }

        @Test
        void shouldFlagUndocumentedDistanceOperation() {
            ConsistencyReport report = engine.analyze(
                    "def compute_dist(x, y): return dist", "Computes the similarity of two points.");

            assertThat(report.operationalGaps()).extracting(OperationalGap::trigger).containsExactly("dist");
            assertThat(report.suggestions().get(0)).startsWith("OPERATIONAL GAP: code performs 'dist'");
            assertThat(report.stats().breakdown()).containsEntry("operationalGaps", 1);
        }

        @Test
        void shouldReturnNoLogicReportForPlainStatements() {
            ConsistencyReport report = engine.analyze("x = 1\ny = 2\nprint(x + y)", "Adds numbers.");

            assertThat(report).isEqualTo(ConsistencyReport.noLogic());
            assertThat(report.summary()).isEqualTo(ConsistencyReport.NO_LOGIC_SUMMARY);
            assertThat(report.suggestions()).containsExactly(ConsistencyReport.NO_LOGIC_SUGGESTION);
        }
    }

    @Test
    void shouldTreatCodeCommentsAsDocumentation() {
        ConsistencyReport report = engine.analyze("# add numbers\n" + ADD_CODE, "Arithmetic helpers.");

        assertThat(report.documentedEntities()).containsExactly("add");
        assertThat(report.summary()).startsWith("PERFECT ALIGNMENT");
    }

    @Test
    void shouldAnalyzeSeveralSourceFiles() {
        List<SourceUnit> sources = List.of(
                new SourceUnit("Shop.java", "public class Shop { public void checkout() {} }"),
                new SourceUnit("util.py", "def format_price(value):\n    return value"));

        ConsistencyReport report = engine.analyze(sources, "The Shop class handles checkout.");

        assertThat(report.documentedEntities()).containsExactly("checkout", "Shop");
        assertThat(report.undocumentedEntities()).containsExactly("format_price");
        assertThat(report.summary())
                .isEqualTo("DOCUMENTATION DEBT: 1 of 3 entities are missing coverage. Missing: format_price");
        assertThat(report.suggestions()).contains("Document function 'format_price' (util.py).");
    }

    @Test
    void shouldBeIdempotent() {
        String code = "class Cache:\n    def evict(self, key): return key";
        String doc = "The cache evicts keys when full.";

        assertThat(engine.analyze(code, doc)).isEqualTo(engine.analyze(code, doc));
    }

    @Test
    void shouldReturnNoLogicReportForEmptyCode() {
        assertThat(engine.analyze("", "Some documentation.")).isEqualTo(ConsistencyReport.noLogic());
        assertThat(engine.analyze((String) null, null)).isEqualTo(ConsistencyReport.noLogic());
        assertThat(engine.analyze(List.of(), "docs")).isEqualTo(ConsistencyReport.noLogic());
    }

    @Test
    void shouldReportOnDeeplyNestedJavaSource() {
        String code = "class BigConstants { String value = \"x\"" + " + \"x\"".repeat(20_000) + "; }";

        ConsistencyReport report = engine.analyze(List.of(new SourceUnit("Big.java", code)), "Big constants.");

        assertThat(report).isNotNull();
        assertThat(report.undocumentedEntities()).containsExactly("BigConstants");
    }

    @Test
    void shouldKeepCommentBlocksWithinTheirOwnFile() {
        List<SourceUnit> sources = List.of(
                new SourceUnit("a.js", "function alphaOne() {}\n/* unterminated note"),
                new SourceUnit("b.js", "function hiddenHelper() {} */"));

        ConsistencyReport report = engine.analyze(sources, "Alpha one.");

        assertThat(report.undocumentedEntities()).contains("hiddenHelper");
    }

    @Test
    void shouldTurnStackOverflowIntoFailedReport() {
        EntityExtractor overflowing = new EntityExtractor() {
            @Override
            public boolean supports(SourceUnit unit) {
                return true;
            }

            @Override
            public Set<CodeEntity> extract(SourceUnit unit) {
                throw new StackOverflowError();
            }
        };
        ConsistencyEngine failing = engine(
                new CompositeEntityExtractor(List.of(overflowing), new LexicalEntityExtractor()), false);

        ConsistencyReport report = failing.analyze(ADD_CODE, "docs");

        assertThat(report.summary()).isEqualTo(ConsistencyReport.FAILED_SUMMARY);
        assertThat(report.suggestions()).containsExactly("Analysis error: StackOverflowError");
    }

    @Test
    void shouldTurnInternalFailuresIntoFailedReport() {
        EntityExtractor broken = new EntityExtractor() {
            @Override
            public boolean supports(SourceUnit unit) {
                return true;
            }

            @Override
            public Set<CodeEntity> extract(SourceUnit unit) {
                throw new IllegalStateException("boom");
            }
        };
        ConsistencyEngine failing = engine(
                new CompositeEntityExtractor(List.of(broken), new LexicalEntityExtractor()), false);

        ConsistencyReport report = failing.analyze(ADD_CODE, "docs");

        assertThat(report.summary()).isEqualTo(ConsistencyReport.FAILED_SUMMARY);
        assertThat(report.suggestions()).containsExactly("Analysis error: boom");
        assertThat(report.score()).isZero();
    }
}
