package com.example.docsync.extraction;

import com.example.docsync.analysis.TextNormalizer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceExtractorTest {

    private final ReferenceExtractor substring = new ReferenceExtractor(TextNormalizer.withDefaults(), false);
    private final ReferenceExtractor strict = new ReferenceExtractor(TextNormalizer.withDefaults(), true);

    @Nested
    class Comments {

        @Test
        void shouldCollectBlockCommentsDocstringsThenLineComments() {
            String code = """
                    x = 1  # compute totals
                    /* block text */
                    def f():
                        \"\"\"Doc string.\"\"\"
                    """;

            assertThat(substring.extractComments(code)).isEqualTo("block text Doc string. compute totals");
        }

        @Test
        void shouldNotCollectLineCommentsNestedInBlocks() {
            assertThat(substring.extractComments("/* see // inner */ int a;")).isEqualTo("see // inner");
        }

        @Test
        void shouldReturnEmptyWithoutComments() {
            assertThat(substring.extractComments("int a = 1;")).isEmpty();
            assertThat(substring.extractComments(null)).isEmpty();
        }
    }

    @Nested
    class Matching {

        @Test
        void shouldMatchSubstringsByDefault() {
            ReferencePool pool = substring.extractReferences("This function adds two numbers.", "");

            assertThat(pool.wordBoundary()).isFalse();
            assertThat(pool.mentions("add")).isTrue();
        }

        @Test
        void shouldRequireWholeWordsWhenConfigured() {
            ReferencePool pool = strict.extractReferences("This function adds two numbers; see compute_total.", "");

            assertThat(pool.mentions("add")).isFalse();
            assertThat(pool.mentions("adds")).isTrue();
            assertThat(pool.mentions("compute")).isFalse();
            assertThat(pool.mentions("compute_total")).isTrue();
        }

        @Test
        void shouldMatchCaseInsensitivelyAcrossDocsAndComments() {
            ReferencePool pool = substring.extractReferences("The paymentgateway charges cards.", "retries on timeout");

            assertThat(pool.mentions("PaymentGateway")).isTrue();
            assertThat(pool.mentions("timeout")).isTrue();
            assertThat(pool.mentions("refund")).isFalse();
            assertThat(pool.tokens()).contains("paymentgateway", "retries");
        }

        @Test
        void shouldTreatBlankNamesAsUnmentioned() {
            assertThat(substring.extractReferences("anything", "").mentions(" ")).isFalse();
            assertThat(substring.extractReferences(null, null).isEmpty()).isTrue();
        }
    }
}
