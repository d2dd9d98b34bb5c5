package com.eainde.planner.hashtag;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.ComplianceCheck;
import com.eainde.planner.model.ComplianceReport;
import com.eainde.planner.model.HashtagWindow;
import com.eainde.planner.model.OptimizedHashtagSet;
import com.eainde.planner.model.Platform;
import com.eainde.planner.rules.KeywordRuleTable;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Fits a hashtag set to one platform's guidelines.
 *
 * <h3>Steps:</h3>
 * <ol>
 *   <li>Window: the platform window narrowed by the content type's "N-M" guidance. A
 *       content-type range outside the platform window is ignored and noted.</li>
 *   <li>Tags containing an avoid keyword are dropped; duplicates collapse.</li>
 *   <li>Over the maximum: rank by business relevance and truncate.</li>
 *   <li>Under the minimum: backfill from industry defaults, then general defaults.
 *       Still short is reported as under-filled, not raised.</li>
 *   <li>Stable re-rank by platform relevance criteria.</li>
 *   <li>Compliance report.</li>
 * </ol>
 *
 * <p>Reads and writes nothing in the store.</p>
 */
@Log4j2
@Component
public class PlatformHashtagOptimizer extends AbstractPlanningStage<OptimizationRequest, OptimizedHashtagSet> {

    static final double BEST_PRACTICE_THRESHOLD = 0.7;

    static final KeywordRuleTable<List<String>> INDUSTRY_DEFAULTS = KeywordRuleTable.<List<String>>builder()
            .rule(List.of("#tech", "#innovation", "#digital"), "technology")
            .rule(List.of("#health", "#wellness", "#medical"), "healthcare")
            .rule(List.of("#finance", "#investment", "#money"), "finance")
            .rule(List.of("#education", "#learning", "#knowledge"), "education")
            .rule(List.of("#ecommerce", "#retail", "#online"), "e-commerce")
            .build();

    static final List<String> GENERAL_DEFAULTS =
            List.of("#business", "#professional", "#growth", "#success", "#marketing");

    private static final List<String> BUSINESS_KEYWORDS = List.of("business", "professional", "industry", "marketing");
    private static final List<String> PROFESSIONAL_KEYWORDS =
            List.of("business", "professional", "career", "industry", "leadership");
    private static final List<String> CASUAL_KEYWORDS = List.of("fun", "party", "casual", "personal", "lifestyle");

    @Override
    public String name() {
        return StageNames.PLATFORM_HASHTAG_OPTIMIZER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(OptimizationRequest request) {
        return List.of();
    }

    @Override
    protected StageOutput<OptimizedHashtagSet> process(ContextStore store, OptimizationRequest request) {
        OptimizedHashtagSet optimized = optimize(request);
        return StageOutput.of(optimized, "Optimized " + optimized.hashtags().size()
                + " hashtags for " + optimized.platform());
    }

    public OptimizedHashtagSet optimize(OptimizationRequest request) {
        if (request == null || request.platform() == null) {
            throw new ValidationException("Hashtag set and platform are required");
        }
        if (request.hashtags().isEmpty()) {
            throw new ValidationException("Hashtag set must not be empty");
        }

        PlatformHashtagRules rules = PlatformHashtagRules.forPlatform(request.platform());
        List<String> notes = new ArrayList<>();
        HashtagWindow window = effectiveWindow(rules, request.contentType(), notes);

        // 1. avoid filter + case-insensitive dedup, first seen wins
        List<String> kept = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int dropped = 0;
        for (String tag : request.hashtags()) {
            if (rules.isAvoided(tag)) {
                dropped++;
            } else if (seen.add(tag.toLowerCase(Locale.ROOT))) {
                kept.add(tag);
            }
        }
        if (dropped > 0) {
            notes.add("Removed " + dropped + " hashtag(s) on the " + rules.platform() + " avoid list");
        }

        // 2. over the maximum: keep the most business-relevant
        if (kept.size() > window.max()) {
            kept = stableRank(kept, tag -> businessRelevance(tag, request.industry()));
            notes.add("Trimmed " + (kept.size() - window.max()) + " hashtag(s) to the maximum of " + window.max());
            kept = new ArrayList<>(kept.subList(0, window.max()));
        }

        // 3. under the minimum: backfill
        if (kept.size() < window.min()) {
            int before = kept.size();
            backfill(kept, seen, rules, request.industry(), window.min());
            notes.add("Added " + (kept.size() - before) + " default hashtag(s) toward the minimum of " + window.min());
        }
        boolean underFilled = kept.size() < window.min();
        if (underFilled) {
            log.warn("{}: only {} hashtag(s) available, minimum is {}", rules.platform(), kept.size(), window.min());
        }

        // 4. final platform ordering
        List<String> ranked = stableRank(kept, rules::platformRelevance);

        ComplianceReport report = complianceReport(ranked, rules, window, request.industry());
        return new OptimizedHashtagSet(rules.platform(), request.contentType(), ranked, window,
                underFilled, notes, report);
    }

    // ==================================================================================
    // Steps
    // ==================================================================================

    HashtagWindow effectiveWindow(PlatformHashtagRules rules, String contentType, List<String> notes) {
        HashtagWindow platformWindow = rules.window();
        return rules.contentTypeWindow(contentType)
                .map(typeWindow -> platformWindow.intersect(typeWindow).orElseGet(() -> {
                    notes.add("Content type range " + typeWindow + " for " + contentType
                            + " lies outside the platform range " + platformWindow + ", using the platform range");
                    return platformWindow;
                }))
                .orElse(platformWindow);
    }

    private void backfill(List<String> kept, Set<String> seen, PlatformHashtagRules rules,
                          String industry, int target) {
        List<String> pool = new ArrayList<>(INDUSTRY_DEFAULTS.firstMatchOrDefault(industry, List.of()));
        pool.addAll(GENERAL_DEFAULTS);
        for (String tag : pool) {
            if (kept.size() >= target) {
                return;
            }
            if (!rules.isAvoided(tag) && seen.add(tag.toLowerCase(Locale.ROOT))) {
                kept.add(tag);
            }
        }
    }

    /** Industry word +3, business keyword +2, 4..10 characters +1. */
    static int businessRelevance(String tag, String industry) {
        String clean = PlatformHashtagRules.clean(tag);
        int score = 0;
        if (industryWords(industry).stream().anyMatch(clean::contains)) {
            score += 3;
        }
        if (BUSINESS_KEYWORDS.stream().anyMatch(clean::contains)) {
            score += 2;
        }
        if (clean.length() >= 4 && clean.length() <= 10) {
            score += 1;
        }
        return score;
    }

    static List<String> stableRank(List<String> tags, ToIntFunction<String> score) {
        List<String> ranked = new ArrayList<>(tags);
        ranked.sort(Comparator.comparingInt(score).reversed());
        return ranked;
    }

    // ==================================================================================
    // Compliance
    // ==================================================================================

    /** Checks a set against the platform's own window, no content-type narrowing. */
    public ComplianceReport check(List<String> tags, Platform platform, String industry) {
        if (tags == null || platform == null) {
            throw new ValidationException("Hashtag set and platform are required");
        }
        PlatformHashtagRules rules = PlatformHashtagRules.forPlatform(platform);
        return complianceReport(tags, rules, rules.window(), industry == null ? "" : industry);
    }

    ComplianceReport complianceReport(List<String> tags, PlatformHashtagRules rules,
                                      HashtagWindow window, String industry) {
        boolean countOk = window.contains(tags.size());
        // every tag must carry an appropriate keyword and none an avoided one
        boolean appropriate = tags.stream().allMatch(tag -> rules.isAppropriate(tag) && !rules.isAvoided(tag));
        boolean avoidOk = tags.stream().noneMatch(rules::isAvoided);

        long adhered = rules.bestPractices().stream()
                .filter(practice -> adheres(tags, PlatformHashtagRules.checkFor(practice), industry))
                .count();
        boolean practicesOk = adhered >= rules.bestPractices().size() * BEST_PRACTICE_THRESHOLD;

        return new ComplianceReport(
                ComplianceCheck.evaluate(countOk,
                        "Use between " + window.min() + " and " + window.max() + " hashtags"),
                ComplianceCheck.evaluate(appropriate,
                        "Replace inappropriate hashtags with platform-suitable alternatives"),
                ComplianceCheck.evaluate(avoidOk,
                        "Remove hashtags that appear on the platform's avoid list"),
                ComplianceCheck.evaluate(practicesOk,
                        "Review and align with platform best practices (" + adhered + " of "
                                + rules.bestPractices().size() + " met)"));
    }

    static boolean adheres(List<String> tags, PlatformHashtagRules.PracticeCheck check, String industry) {
        return switch (check) {
            case SPARING -> tags.size() <= 3;
            case COMMUNITY -> tags.stream().anyMatch(tag -> {
                String lowered = tag.toLowerCase(Locale.ROOT);
                return lowered.contains("community") || lowered.contains("local");
            });
            case PROFESSIONAL -> countContaining(tags, PROFESSIONAL_KEYWORDS) >= countContaining(tags, CASUAL_KEYWORDS);
            case RELEVANT -> {
                List<String> words = industryWords(industry);
                long relevant = tags.stream()
                        .map(PlatformHashtagRules::clean)
                        .filter(clean -> words.stream().anyMatch(clean::contains))
                        .count();
                yield relevant >= tags.size() * 0.5;
            }
            case ALWAYS -> true;
        };
    }

    private static long countContaining(List<String> tags, List<String> keywords) {
        return tags.stream().filter(tag -> PlatformHashtagRules.containsAny(tag, keywords)).count();
    }

    private static List<String> industryWords(String industry) {
        return Arrays.stream(industry.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isBlank())
                .toList();
    }
}
