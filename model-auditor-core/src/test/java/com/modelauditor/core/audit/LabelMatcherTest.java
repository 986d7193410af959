package com.modelauditor.core.audit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LabelMatcher}.
 */
class LabelMatcherTest {

    @Test
    void normalize_lowerCasesCollapsesWhitespaceAndDropsColon() {
        assertThat(LabelMatcher.normalize("  Total   Assets: ")).isEqualTo("total assets");
        assertThat(LabelMatcher.normalize(null)).isEmpty();
    }

    @Test
    void containsAny_matchesSubstrings() {
        assertThat(LabelMatcher.containsAny("TOTAL ASSETS (USD m)", List.of("total assets"))).isTrue();
        assertThat(LabelMatcher.containsAny("Current assets", List.of("total assets"))).isFalse();
        assertThat(LabelMatcher.containsAny("", List.of(""))).isFalse();
    }

    @Test
    void containsWords_respectsWordBoundaries() {
        assertThat(LabelMatcher.containsWords("BS", "bs")).isTrue();
        assertThat(LabelMatcher.containsWords("BS - Consolidated", "bs")).isTrue();
        assertThat(LabelMatcher.containsWords("Jobs", "bs")).isFalse();
        assertThat(LabelMatcher.containsWords("Balance Sheet 2024", "balance sheet")).isTrue();
    }
}
