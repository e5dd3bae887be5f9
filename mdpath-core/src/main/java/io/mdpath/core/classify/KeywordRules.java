package io.mdpath.core.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/// Ordered list of (pattern, label) rules evaluated first-match-wins.
///
/// Rules are evaluated in the order they were declared; reordering them changes
/// classification outcomes. Phrases are matched on whole words against text normalized by
/// {@link #normalize(String)}. Spans matching an ignored pattern, such as negated mentions,
/// are blanked out before any rule runs.
///
/// ### Example
/// {@snippet :
/// KeywordRules<SymptomStatus> rules = KeywordRules.<SymptomStatus>builder()
///     .ignoring("\\bno (headache|seizure)s?\\b")
///     .phrases(SymptomStatus.NONE, "asymptomatic", "no symptoms")
///     .phrases(SymptomStatus.PRESENT, "headache", "seizure")
///     .build();
/// Optional<SymptomStatus> status = rules.classify("Mild headache since May");
/// }
///
/// @param <T> label type
/// @implNote Immutable and thread-safe after construction.
public final class KeywordRules<T> {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_/,;:.()]+");

    private final List<Rule<T>> rules;
    private final List<Pattern> ignored;

    private KeywordRules(List<Rule<T>> rules, List<Pattern> ignored) {
        this.rules = List.copyOf(rules);
        this.ignored = List.copyOf(ignored);
    }

    /// A single classification rule.
    ///
    /// @param label the label produced when the pattern matches, not null
    /// @param pattern pattern matched against normalized text, not null
    public record Rule<T>(T label, Pattern pattern) {
        public Rule {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(pattern, "pattern");
        }

        boolean matches(String normalized) {
            return pattern.matcher(normalized).find();
        }
    }

    /// Classifies text against the rules in declaration order.
    ///
    /// @param text raw text, may be null
    /// @return label of the first matching rule, empty if none matches or text is blank
    public Optional<T> classify(String text) {
        String normalized = normalize(text);
        for (Pattern pattern : ignored) {
            normalized = pattern.matcher(normalized).replaceAll(" ");
        }
        normalized = normalized.trim();
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (Rule<T> rule : rules) {
            if (rule.matches(normalized)) {
                return Optional.of(rule.label());
            }
        }
        return Optional.empty();
    }

    /// Returns the rules in evaluation order.
    ///
    /// @return unmodifiable list, never null
    public List<Rule<T>> getRules() {
        return rules;
    }

    /// Lower-cases text and collapses whitespace and punctuation into single spaces.
    ///
    /// @param text raw text, may be null
    /// @return normalized text, empty string for null or blank input
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return SEPARATORS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /// Builder collecting rules in evaluation order.
    public static final class Builder<T> {
        private final List<Rule<T>> rules = new ArrayList<>();
        private final List<Pattern> ignored = new ArrayList<>();

        private Builder() {}

        /// Adds one rule per phrase, each matched as whole words.
        ///
        /// @param label label for all phrases, not null
        /// @param phrases phrases in any casing, normalized before compiling
        /// @return this builder for chaining
        public Builder<T> phrases(T label, String... phrases) {
            for (String phrase : phrases) {
                String normalized = normalize(phrase);
                if (normalized.isEmpty()) {
                    throw new IllegalArgumentException("Blank phrase for label " + label);
                }
                rules.add(
                        new Rule<>(label, Pattern.compile("\\b" + Pattern.quote(normalized) + "\\b")));
            }
            return this;
        }

        /// Adds a rule with a raw regular expression over normalized text.
        ///
        /// @param label label produced on match, not null
        /// @param regex expression matched with `find()`, not null
        /// @return this builder for chaining
        public Builder<T> pattern(T label, String regex) {
            rules.add(new Rule<>(label, Pattern.compile(regex)));
            return this;
        }

        /// Blanks out spans of normalized text before rules are evaluated.
        ///
        /// Ignored patterns apply in declaration order, independent of where they are
        /// declared relative to rules.
        ///
        /// @param regex expression over normalized text, not null
        /// @return this builder for chaining
        public Builder<T> ignoring(String regex) {
            ignored.add(Pattern.compile(regex));
            return this;
        }

        public KeywordRules<T> build() {
            if (rules.isEmpty()) {
                throw new IllegalStateException("At least one rule required");
            }
            return new KeywordRules<>(rules, ignored);
        }
    }
}
