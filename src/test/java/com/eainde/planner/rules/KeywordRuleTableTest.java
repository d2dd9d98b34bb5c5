package com.eainde.planner.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordRuleTableTest {

    private final KeywordRuleTable<String> goals = KeywordRuleTable.<String>builder()
            .rule("brand_awareness", "awareness", "visibility", "brand")
            .rule("lead_generation", "lead", "generate", "prospect")
            .rule("conversion", "Sales", "conversion")
            .build();

    @Test
    @DisplayName("matchAll returns every matching category in table order")
    void matchAllInTableOrder() {
        assertThat(goals.matchAll("Generate leads and BRAND awareness"))
                .containsExactly("brand_awareness", "lead_generation");
    }

    @Test
    @DisplayName("keywords match case-insensitively as substrings")
    void caseInsensitiveSubstring() {
        assertThat(goals.firstMatch("more salesforce pipeline")).contains("conversion");
    }

    @Test
    @DisplayName("no match falls back to the default")
    void fallback() {
        assertThat(goals.matchAll("")).isEmpty();
        assertThat(goals.matchAll(null)).isEmpty();
        assertThat(goals.firstMatchOrDefault("retention", "none")).isEqualTo("none");
    }
}
