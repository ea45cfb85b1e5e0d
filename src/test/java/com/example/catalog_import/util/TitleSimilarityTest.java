package com.example.catalog_import.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleSimilarityTest {

    @Test
    void normalizeFoldsAccentsAndPunctuation() {
        assertThat(TitleSimilarity.normalize("Amélie: Le Fabuleux Destin")).isEqualTo("amelie le fabuleux destin");
        assertThat(TitleSimilarity.normalize("Fast & Furious")).isEqualTo("fast and furious");
        assertThat(TitleSimilarity.normalize(null)).isEmpty();
    }

    @Test
    void similarityRewardsSharedTokens() {
        assertThat(TitleSimilarity.similarity("The Matrix", "the.matrix")).isEqualTo(1.0);
        assertThat(TitleSimilarity.similarity("The Matrix Reloaded", "The Matrix")).isGreaterThan(0.5);
        assertThat(TitleSimilarity.similarity("The Matrix", "Notting Hill")).isLessThan(0.5);
        assertThat(TitleSimilarity.similarity("", "x")).isZero();
    }
}
