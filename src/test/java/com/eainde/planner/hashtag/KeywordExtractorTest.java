package com.eainde.planner.hashtag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    @Test
    @DisplayName("ranks by frequency, ties in first-seen order")
    void frequencyThenFirstSeen() {
        assertThat(KeywordExtractor.extract("Cloud tips for cloud teams", "Tips about cloud security"))
                .containsExactly("cloud", "tips", "teams", "about", "security");
    }

    @Test
    @DisplayName("drops stop words, short words and non-letters")
    void filters() {
        assertThat(KeywordExtractor.extract("The AI and the data-driven 2026 roadmap, those were")).containsExactly("data", "driven", "roadmap");
    }

    @Test
    @DisplayName("null and blank texts yield no keywords")
    void empty() {
        assertThat(KeywordExtractor.extract(null, "  ")).isEmpty();
    }

    @Test
    @DisplayName("keeps at most fifteen keywords")
    void limit() {
        String text = IntStream.range(0, 20)
                .mapToObj(i -> "word" + (char) ('a' + i))
                .collect(Collectors.joining(" "));

        assertThat(KeywordExtractor.extract(text)).hasSize(KeywordExtractor.MAX_KEYWORDS);
    }
}
