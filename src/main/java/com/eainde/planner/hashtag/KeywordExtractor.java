package com.eainde.planner.hashtag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-ranked content keywords of a post.
 */
public final class KeywordExtractor {

    public static final int MAX_KEYWORDS = 15;

    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z]{3,}\\b");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "can", "this", "that", "these", "those");

    private KeywordExtractor() {}

    /**
     * Lowercase words of at least four letters, stop words removed, most frequent first.
     * Ties keep first-seen order. At most {@value #MAX_KEYWORDS} keywords.
     */
    public static List<String> extract(String... texts) {
        StringBuilder all = new StringBuilder();
        for (String text : texts) {
            if (text != null) {
                all.append(text).append(' ');
            }
        }

        Map<String, Integer> frequency = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(all.toString().toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                frequency.merge(word, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequency.entrySet());
        ranked.sort((left, right) -> Integer.compare(right.getValue(), left.getValue()));
        return ranked.stream()
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();
    }
}
