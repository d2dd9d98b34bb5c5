package com.eainde.planner.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered (keywords → category) rules matched by case-insensitive substring.
 *
 * <h3>Matching:</h3>
 * <ul>
 *   <li>A rule matches when any of its keywords occurs in the text.</li>
 *   <li>{@link #matchAll(String)} returns every matching category in table order.</li>
 *   <li>{@link #firstMatch(String)} returns the first matching category.</li>
 * </ul>
 *
 * <pre>
 * KeywordRuleTable&lt;String&gt; goals = KeywordRuleTable.&lt;String&gt;builder()
 *         .rule("brand_awareness", "awareness", "visibility", "brand")
 *         .rule("lead_generation", "lead", "generate", "prospect")
 *         .build();
 * goals.matchAll("Generate leads and brand awareness"); // [brand_awareness, lead_generation]
 * </pre>
 *
 * @param <C> category type
 */
public final class KeywordRuleTable<C> {

    private final List<Rule<C>> rules;

    private KeywordRuleTable(List<Rule<C>> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public List<C> matchAll(String text) {
        String haystack = normalize(text);
        List<C> matches = new ArrayList<>();
        for (Rule<C> rule : rules) {
            if (rule.matches(haystack)) {
                matches.add(rule.category());
            }
        }
        return matches;
    }

    public Optional<C> firstMatch(String text) {
        String haystack = normalize(text);
        return rules.stream()
                .filter(rule -> rule.matches(haystack))
                .map(Rule::category)
                .findFirst();
    }

    public C firstMatchOrDefault(String text, C fallback) {
        return firstMatch(text).orElse(fallback);
    }

    public List<Rule<C>> rules() {
        return rules;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * One row of the table. Keywords are stored lowercase.
     */
    public record Rule<C>(C category, List<String> keywords) {

        boolean matches(String lowercaseText) {
            return keywords.stream().anyMatch(lowercaseText::contains);
        }
    }

    public static final class Builder<C> {

        private final List<Rule<C>> rules = new ArrayList<>();

        private Builder() {}

        public Builder<C> rule(C category, String... keywords) {
            if (keywords.length == 0) {
                throw new IllegalArgumentException("rule for " + category + " needs at least one keyword");
            }
            List<String> lowered = new ArrayList<>(keywords.length);
            for (String keyword : keywords) {
                lowered.add(keyword.toLowerCase(Locale.ROOT));
            }
            rules.add(new Rule<>(category, List.copyOf(lowered)));
            return this;
        }

        public KeywordRuleTable<C> build() {
            return new KeywordRuleTable<>(new ArrayList<>(rules));
        }
    }
}
