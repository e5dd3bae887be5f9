package io.mdpath.core.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class KeywordRulesTest {

    @Test
    void shouldNormalizeCaseAndSeparators() {
        assertThat(KeywordRules.normalize("  Skull-Base / Petro_Clival.  ")).isEqualTo("skull base petro clival");
        assertThat(KeywordRules.normalize(null)).isEmpty();
    }

    @Test
    void shouldReturnFirstMatchingRuleInDeclarationOrder() {
        // Given
        KeywordRules<String> rules =
                KeywordRules.<String>builder()
                        .phrases("first", "red")
                        .phrases("second", "red car", "blue")
                        .build();

        // Then
        assertThat(rules.classify("a red car")).contains("first");
        assertThat(rules.classify("a blue car")).contains("second");
        assertThat(rules.classify("green")).isEmpty();
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        KeywordRules<String> rules = KeywordRules.<String>builder().phrases("str", "str").build();

        assertThat(rules.classify("STR performed")).contains("str");
        assertThat(rules.classify("stroke history")).isEmpty();
    }

    @Test
    void shouldMatchRegexAgainstNormalizedText() {
        KeywordRules<Integer> rules =
                KeywordRules.<Integer>builder().pattern(2, "\\bgrade (ii|2)\\b").build();

        assertThat(rules.classify("WHO Grade-II")).contains(2);
    }

    @Test
    void shouldExposeRulesInDeclarationOrder() {
        KeywordRules<String> rules =
                KeywordRules.<String>builder().phrases("a", "x", "y").pattern("b", "z+").build();

        assertThat(rules.getRules()).extracting(KeywordRules.Rule::label).containsExactly("a", "a", "b");
        assertThat(rules.getRules().get(2).pattern().pattern()).isEqualTo("z+");
    }

    @Test
    void shouldBlankIgnoredSpansBeforeAnyRule() {
        // Given
        KeywordRules<String> rules =
                KeywordRules.<String>builder()
                        .phrases("red", "red")
                        .phrases("blue", "blue")
                        .ignoring("\\bno red\\b")
                        .build();

        // Then
        assertThat(rules.classify("No red")).isEmpty();
        assertThat(rules.classify("no red, one blue")).contains("blue");
        assertThat(rules.classify("red, no red")).contains("red");
    }

    @Test
    void shouldRejectEmptyRuleSet() {
        assertThatThrownBy(() -> KeywordRules.<String>builder().build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectBlankPhrase() {
        assertThatThrownBy(() -> KeywordRules.<String>builder().phrases("x", " - "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Blank phrase");
    }
}
