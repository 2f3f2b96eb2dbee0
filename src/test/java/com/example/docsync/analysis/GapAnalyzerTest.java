package com.example.docsync.analysis;

import com.example.docsync.model.GapSet;
import com.example.docsync.model.OperationalGap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GapAnalyzerTest {

    private final GapAnalyzer analyzer =
            new GapAnalyzer(TextNormalizer.withDefaults(), OperationalTriggerTable.defaults());

    @Nested
    class VocabularyGaps {

        @Test
        void shouldPartitionTheUnionOfBothVocabularies() {
            GapSet gaps = analyzer.analyzeGaps(Set.of("alpha", "beta", "gamma"), Set.of("beta", "gamma", "delta"));

            assertThat(gaps.common()).containsExactly("beta", "gamma");
            assertThat(gaps.missingInDoc()).containsExactly("alpha");
            assertThat(gaps.missingInCode()).containsExactly("delta");
            assertThat(gaps.union()).containsExactlyInAnyOrder("alpha", "beta", "gamma", "delta");
        }

        @Test
        void shouldProducePairwiseDisjointSets() {
            GapSet gaps = analyzer.analyzeGaps(Set.of("a1", "b2", "c3"), Set.of("c3", "d4"));

            assertThat(gaps.common()).doesNotContainAnyElementsOf(gaps.missingInDoc());
            assertThat(gaps.common()).doesNotContainAnyElementsOf(gaps.missingInCode());
            assertThat(gaps.missingInDoc()).doesNotContainAnyElementsOf(gaps.missingInCode());
        }

        @Test
        void shouldHandleEmptyVocabularies() {
            GapSet gaps = analyzer.analyzeGaps(Set.of(), Set.of());
            assertThat(gaps.union()).isEmpty();
        }
    }

    @Nested
    class OperationalAlignment {

        @Test
        @DisplayName("'dist' in code with no distance wording in docs yields one gap")
        void shouldFlagUndocumentedTrigger() {
            List<OperationalGap> gaps = analyzer.checkOperationalAlignment(
                    "def compute_dist(x, y): return dist", "Computes the similarity of two points.");

            assertThat(gaps).hasSize(1);
            assertThat(gaps.get(0).trigger()).isEqualTo("dist");
            assertThat(gaps.get(0).missingSynonyms())
                    .containsExactly("distance", "euclidean", "manhattan", "metric", "proximity");
            assertThat(gaps.get(0).message()).startsWith("OPERATIONAL GAP: code performs 'dist'");
        }

        @Test
        void shouldAcceptSynonymInDocumentation() {
            assertThat(analyzer.checkOperationalAlignment(
                    "def compute_dist(x, y): return dist", "Uses euclidean geometry.")).isEmpty();
        }

        @Test
        void shouldAcceptInflectedFormsOfLongSynonyms() {
            assertThat(analyzer.checkOperationalAlignment(
                    "def compute_dist(x, y): return dist", "Distances are reported in meters.")).isEmpty();
        }

        @Test
        void shouldNotPrefixMatchShortSynonyms() {
            List<OperationalGap> gaps = analyzer.checkOperationalAlignment(
                    "def train(model): pass", "Fitness tracking dashboard.");

            assertThat(gaps).extracting(OperationalGap::trigger).containsExactly("train");
        }

        @Test
        void shouldRequireTriggerAsWholeCodeToken() {
            assertThat(analyzer.checkOperationalAlignment(
                    "def distribute(items): pass", "Spreads items across workers.")).isEmpty();
        }

        @Test
        void shouldDetectTriggersInsideCamelCaseIdentifiers() {
            List<OperationalGap> gaps = analyzer.checkOperationalAlignment(
                    "double d = calcDist(a, b);", "Sums both values.");

            assertThat(gaps).extracting(OperationalGap::trigger).containsExactly("dist");
        }

        @Test
        void shouldNotSplitLowercaseWordsContainingTriggers() {
            assertThat(analyzer.checkOperationalAlignment(
                    "distributeWork(items)", "Spreads items across workers.")).isEmpty();
        }

        @Test
        void shouldAcceptCamelCaseSynonymsInDocumentation() {
            assertThat(analyzer.checkOperationalAlignment(
                    "double d = calcDist(a, b);", "See euclideanDistance in the helpers.")).isEmpty();
        }

        @Test
        void shouldReportGapsInTableOrder() {
            List<OperationalGap> gaps = analyzer.checkOperationalAlignment(
                    "retry(save(load(x)))", "Nothing relevant here.");

            assertThat(gaps).extracting(OperationalGap::trigger).containsExactly("save", "load", "retry");
        }

        @Test
        void shouldUseCustomTriggerTable() {
            GapAnalyzer custom = new GapAnalyzer(TextNormalizer.withDefaults(),
                    new OperationalTriggerTable(Map.of("Publish", List.of("Broadcast"))));

            assertThat(custom.checkOperationalAlignment("publish(event)", "We broadcast events.")).isEmpty();
            assertThat(custom.checkOperationalAlignment("publish(event)", "Events are queued."))
                    .extracting(OperationalGap::trigger).containsExactly("publish");
        }

        @Test
        void shouldReturnNothingForEmptyCode() {
            assertThat(analyzer.checkOperationalAlignment("", "dist")).isEmpty();
        }
    }
}
