package com.modelauditor.core.score;

import com.modelauditor.core.model.ComplexityScore;
import com.modelauditor.core.model.GraphStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComplexityScorer}.
 */
class ComplexityScorerTest {

    private static GraphStats stats(int sheets, int formulas, int populated, int depth, int edges, int crossSheet) {
        return new GraphStats(sheets, populated, formulas, populated - formulas, 0,
            populated, edges, 0, crossSheet, depth, 0, 0, 0, 0, 0);
    }

    @Test
    void score_smallModel_isOne() {
        ComplexityScore score = ComplexityScorer.score(stats(1, 10, 100, 2, 10, 0));

        assertThat(score.value()).isEqualTo(1);
        assertThat(score.drivers()).isEmpty();
        assertThat(score.rationale()).isEqualTo("Simple structure");
    }

    @Test
    void score_nullOrEmpty_isOne() {
        assertThat(ComplexityScorer.score(null).value()).isEqualTo(1);
        assertThat(ComplexityScorer.score(GraphStats.empty()).value()).isEqualTo(1);
    }

    @Test
    void score_breakpointsAreStrict() {
        assertThat(ComplexityScorer.score(stats(3, 50, 1000, 5, 100, 5)).value()).isEqualTo(1);
        assertThat(ComplexityScorer.score(stats(4, 50, 1000, 5, 100, 5)).value()).isEqualTo(2);
    }

    @Test
    void score_highestExceededTierWins() {
        // Given: sheet count reaches tier 4, depth only tier 3
        GraphStats stats = stats(16, 100, 1000, 13, 100, 0);

        // When
        ComplexityScore score = ComplexityScorer.score(stats);

        // Then
        assertThat(score.value()).isEqualTo(4);
        assertThat(score.drivers()).containsExactly("Sheet count 16 > 15");
    }

    @Test
    void score_listsEveryExceededBreakpointOfTheTier() {
        GraphStats stats = stats(9, 600, 800, 13, 100, 30);

        ComplexityScore score = ComplexityScorer.score(stats);

        assertThat(score.value()).isEqualTo(3);
        assertThat(score.drivers()).containsExactly(
            "Sheet count 9 > 8",
            "Formula count 600 > 500",
            "Dependency depth 13 > 12",
            "Cross-sheet references 30% > 20%",
            "Formula density 75% > 60%");
        assertThat(score.rationale()).startsWith("Sheet count 9 > 8, Formula count");
    }

    @Test
    void score_hugeModel_isFive() {
        assertThat(ComplexityScorer.score(stats(2, 12_000, 20_000, 3, 10, 0)).value()).isEqualTo(5);
    }
}
