package com.example.docsync.analysis;

import com.example.docsync.model.AlignmentLabel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringPolicyTest {

    private final ScoringPolicy policy = ScoringPolicy.defaults();

    @ParameterizedTest
    @CsvSource({
            "1.0,  PRODUCTION_QUALITY",
            "0.86, PRODUCTION_QUALITY",
            "0.85, HIGH_ALIGNMENT",
            "0.66, HIGH_ALIGNMENT",
            "0.65, PARTIAL_ALIGNMENT",
            "0.41, PARTIAL_ALIGNMENT",
            "0.40, POOR_ALIGNMENT",
            "0.0,  POOR_ALIGNMENT"
    })
    void shouldUseExclusiveLowerBounds(double score, AlignmentLabel expected) {
        assertThat(policy.labelFor(score)).isEqualTo(expected);
    }

    @Test
    void shouldNeverDowngradeLabelAsScoreGrows() {
        AlignmentLabel previous = policy.labelFor(0.0);
        for (int i = 1; i <= 100; i++) {
            AlignmentLabel current = policy.labelFor(i / 100.0);
            assertThat(previous.isBetterThan(current)).as("score %d%%", i).isFalse();
            previous = current;
        }
    }

    @Test
    void shouldRejectUnorderedBands() {
        assertThatThrownBy(() -> new ScoringPolicy(0.5, 0.6, 0.4, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("partial < high < production");
        assertThatThrownBy(() -> new ScoringPolicy(1.2, 0.6, 0.4, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNonPositiveSuggestionLimit() {
        assertThatThrownBy(() -> new ScoringPolicy(0.85, 0.65, 0.40, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("suggestionLimit");
    }
}
