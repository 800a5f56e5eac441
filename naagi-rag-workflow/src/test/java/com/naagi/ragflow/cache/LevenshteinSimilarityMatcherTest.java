package com.naagi.ragflow.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LevenshteinSimilarityMatcherTest {

    private final LevenshteinSimilarityMatcher matcher = new LevenshteinSimilarityMatcher();

    @Test
    @DisplayName("Identical strings score 1.0")
    void identicalStrings() {
        assertThat(matcher.similarity("mi a felmondás?", "mi a felmondás?")).isEqualTo(1.0);
        assertThat(matcher.similarity("", "")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Strings with no common characters score 0.0")
    void disjointStrings() {
        assertThat(matcher.similarity("abc", "xyz")).isEqualTo(0.0);
        assertThat(matcher.similarity("abc", "")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Similarity is symmetric")
    void symmetric() {
        String a = "how many vacation days do i get";
        String b = "how many vacation days do we get?";
        assertThat(matcher.similarity(a, b)).isEqualTo(matcher.similarity(b, a));
    }

    @Test
    @DisplayName("Ratio is one minus edit distance over the longer length")
    void ratio() {
        assertThat(LevenshteinSimilarityMatcher.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(matcher.similarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
    }

    @Test
    @DisplayName("Normalization trims, collapses whitespace and lowercases")
    void normalize() {
        assertThat(matcher.normalize("  Mi a   FELMONDÁS? ")).isEqualTo("mi a felmondás?");
        assertThat(matcher.normalize(null)).isEmpty();
        assertThat(matcher.exactMatch("Hello World", "  hello   world")).isTrue();
    }
}
