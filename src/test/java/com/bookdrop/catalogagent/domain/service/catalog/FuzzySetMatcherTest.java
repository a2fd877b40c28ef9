package com.bookdrop.catalogagent.domain.service.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class FuzzySetMatcherTest {

    @Test
    void matches_shouldIgnoreWordOrderAndPunctuation() {
        assertThat(FuzzySetMatcher.matches("Isaac Asimov", "Asimov, Isaac")).isTrue();
        assertThat(FuzzySetMatcher.matches("Ursula K. Le Guin", "Le Guin, Ursula K")).isTrue();
        assertThat(FuzzySetMatcher.matches("Dune_Messiah", "dune: messiah")).isTrue();
    }

    @Test
    void matches_shouldBeCaseInsensitive() {
        assertThat(FuzzySetMatcher.matches("FRANK HERBERT", "frank herbert")).isTrue();
    }

    @Test
    void matches_shouldAcceptSubsetInEitherDirection() {
        assertThat(FuzzySetMatcher.matches("Asimov", "Isaac Asimov")).isTrue();
        assertThat(FuzzySetMatcher.matches("Isaac Asimov", "Asimov")).isTrue();
    }

    @Test
    void matches_shouldRejectDisjointOrOverlappingSets() {
        assertThat(FuzzySetMatcher.matches("Dune", "Foundation")).isFalse();
        assertThat(FuzzySetMatcher.matches("Isaac Newton", "Isaac Asimov")).isFalse();
    }

    @Test
    void matches_shouldBeSymmetric() {
        List<String> samples = List.of("", "Dune", "Frank Herbert", "Herbert, Frank", "Isaac Asimov",
                "Foundation and Empire", "foundation", "Le Guin", "Ursula K. Le Guin", "a.b_c:d");

        for (String a : samples) {
            for (String b : samples) {
                assertThat(FuzzySetMatcher.matches(a, b))
                        .as("'%s' vs '%s'", a, b)
                        .isEqualTo(FuzzySetMatcher.matches(b, a));
            }
        }
    }

    @Test
    void matches_emptyStringIsVacuouslyContained() {
        assertThat(FuzzySetMatcher.matches("", "Frank Herbert")).isTrue();
        assertThat(FuzzySetMatcher.matches(" , . ", "Frank Herbert")).isTrue();
    }

    @Test
    void matchesNonBlank_shouldRejectBlankSides() {
        assertThat(FuzzySetMatcher.matchesNonBlank("", "Frank Herbert")).isFalse();
        assertThat(FuzzySetMatcher.matchesNonBlank("Frank Herbert", "   ")).isFalse();
        assertThat(FuzzySetMatcher.matchesNonBlank(null, "Frank Herbert")).isFalse();
        assertThat(FuzzySetMatcher.matchesNonBlank("Herbert", "Frank Herbert")).isTrue();
    }

    @Test
    void matches_shouldUseCallSiteSeparators() {
        assertThat(FuzzySetMatcher.matches("Left-Hand", "left hand", FuzzySetMatcher.TITLE_SEPARATORS)).isFalse();
        assertThat(FuzzySetMatcher.matches("Left-Hand", "left hand", Pattern.compile("[\\s-]+"))).isTrue();
    }

    @Test
    void tokens_shouldDropEmptyTokens() {
        assertThat(FuzzySetMatcher.tokens("  Frank,  Herbert. ", FuzzySetMatcher.DEFAULT_SEPARATORS))
                .containsExactlyInAnyOrder("frank", "herbert");
        assertThat(FuzzySetMatcher.tokens("", FuzzySetMatcher.DEFAULT_SEPARATORS)).isEmpty();
    }
}
