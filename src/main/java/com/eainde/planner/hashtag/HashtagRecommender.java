package com.eainde.planner.hashtag;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.ComplianceReport;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.HashtagCandidate;
import com.eainde.planner.model.HashtagRecommendation;
import com.eainde.planner.model.HashtagSource;
import com.eainde.planner.model.HashtagWindow;
import com.eainde.planner.model.OptimizedHashtagSet;
import com.eainde.planner.model.Platform;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recommends the hashtag set of one calendar post.
 *
 * <h3>Pipeline:</h3>
 * <ol>
 *   <li>Content keywords from title, caption, theme and goal ({@link KeywordExtractor}).</li>
 *   <li>Candidate pools: trending, industry, audience, platform, branded, content. Tags on
 *       the platform's avoid list are dropped here.</li>
 *   <li>Score: one point per keyword that contains, or is contained in, the tag.</li>
 *   <li>Quotas of the platform maximum: popular 30%, niche 50%, branded 10%, content 10%.</li>
 *   <li>Top-N per category, union in category order, case-insensitive dedup keeping the
 *       first occurrence, stable re-rank by score, truncate to the maximum.</li>
 *   <li>Backfill from the remaining ranked candidates up to the platform minimum.</li>
 * </ol>
 *
 * <p>The final set carries its own compliance report. It is then passed through
 * {@link PlatformHashtagOptimizer}; both sets are kept.</p>
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class HashtagRecommender extends AbstractPlanningStage<HashtagRequest, HashtagRecommendation> {

    public static final int CONTENT_TAG_KEYWORDS = 10;

    static final String POPULAR = "popular";
    static final String NICHE = "niche";
    static final String BRANDED = "branded";
    static final String CONTENT_SPECIFIC = "content_specific";

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.CONTENT_CALENDAR,
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE);

    private static final Pattern HAS_WORD_CHARACTER = Pattern.compile("[\\p{L}\\p{N}]");

    private final PlatformHashtagOptimizer optimizer;

    @Override
    public String name() {
        return StageNames.HASHTAG_RECOMMENDER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(HashtagRequest request) {
        if (request == null) {
            throw new ValidationException("Hashtag request is required");
        }
        ArtifactKeys.checkDay(request.day());
        return REQUIRED;
    }

    @Override
    protected StageOutput<HashtagRecommendation> process(ContextStore store, HashtagRequest request) {
        ContentCalendar calendar = store.require(ArtifactKeys.CONTENT_CALENDAR);
        BusinessProfile business = store.require(ArtifactKeys.BUSINESS_PROFILE);
        DailyPost post = calendar.post(request.day());

        HashtagRecommendation recommendation =
                recommend(post, business.industry(), business.targetAudience(), request.brandedTags());
        OptimizedHashtagSet optimized = optimizer.optimize(new OptimizationRequest(
                recommendation.finalSet(), post.platform(), post.postType(), business.industry()));

        HashtagRecommendation complete = recommendation.withOptimized(optimized);
        return StageOutput.writing(ArtifactKeys.hashtags(request.day()), complete,
                complete.finalSet().size() + " hashtags for day " + request.day() + " on " + post.platform());
    }

    /** Recommendation for a post, keywords extracted from its text. */
    public HashtagRecommendation recommend(DailyPost post, String industry, String audience, List<String> brandedTags) {
        List<String> keywords = KeywordExtractor.extract(post.title(), post.caption(), post.contentTheme(), post.goal());
        return recommendForKeywords(post.day(), post.platform(), industry, audience, brandedTags, keywords);
    }

    /**
     * Recommendation from already extracted keywords. An empty keyword list is valid: every
     * candidate then scores zero and selection follows pool order.
     */
    public HashtagRecommendation recommendForKeywords(int day, Platform platform, String industry, String audience,
                                                      List<String> brandedTags, List<String> keywords) {
        if (platform == null) {
            throw new ValidationException("Platform is required");
        }
        String industryText = industry == null ? "" : industry;
        String audienceText = audience == null ? "" : audience;
        List<String> branded = normalize(brandedTags == null ? List.of() : brandedTags);

        TagTiers industryTiers = HashtagCatalog.industryTiers(industryText);
        TagTiers audienceTiers = HashtagCatalog.audienceTiers(audienceText);

        List<String> trending = new ArrayList<>(HashtagCatalog.GENERAL_TRENDING);
        trending.addAll(HashtagCatalog.industryTrending(industryText));
        trending.addAll(HashtagCatalog.PLATFORM_TRENDING.get(platform));

        List<String> audienceNiche = new ArrayList<>(audienceTiers.niche());
        audienceNiche.addAll(HashtagCatalog.ageNiche(audienceText));

        List<String> contentTags = keywords.stream()
                .limit(CONTENT_TAG_KEYWORDS)
                .map(keyword -> "#" + keyword)
                .toList();

        // quota categories, in union order
        Map<String, List<HashtagCandidate>> categories = new LinkedHashMap<>();
        categories.put(POPULAR, concat(
                score(trending, HashtagSource.TRENDING, keywords),
                score(HashtagCatalog.PLATFORM_BEST_PRACTICE.get(platform), HashtagSource.PLATFORM, keywords),
                score(industryTiers.primary(), HashtagSource.INDUSTRY, keywords),
                score(audienceTiers.primary(), HashtagSource.AUDIENCE, keywords)));
        categories.put(NICHE, concat(
                score(industryTiers.secondary(), HashtagSource.INDUSTRY, keywords),
                score(industryTiers.niche(), HashtagSource.INDUSTRY, keywords),
                score(audienceTiers.secondary(), HashtagSource.AUDIENCE, keywords),
                score(audienceNiche, HashtagSource.AUDIENCE, keywords)));
        categories.put(BRANDED, score(branded, HashtagSource.BRANDED, keywords));
        categories.put(CONTENT_SPECIFIC, score(contentTags, HashtagSource.CONTENT, keywords));

        // avoided tags never compete for a quota slot or a backfill place
        PlatformHashtagRules rules = PlatformHashtagRules.forPlatform(platform);
        categories.replaceAll((category, candidates) -> allowed(candidates, rules, category));

        HashtagWindow window = rules.window();
        Map<String, Integer> quotas = quotas(window.max());

        Map<String, List<String>> breakdown = new LinkedHashMap<>();
        List<HashtagCandidate> union = new ArrayList<>();
        categories.forEach((category, candidates) -> {
            List<HashtagCandidate> picked = rank(dedup(candidates)).stream()
                    .limit(quotas.get(category))
                    .toList();
            breakdown.put(category, picked.stream().map(HashtagCandidate::tag).toList());
            union.addAll(picked);
        });

        List<HashtagCandidate> selected = rank(dedup(union));
        if (selected.size() > window.max()) {
            selected = new ArrayList<>(selected.subList(0, window.max()));
        }

        List<HashtagCandidate> allCandidates = new ArrayList<>();
        categories.values().forEach(allCandidates::addAll);

        if (selected.size() < window.min()) {
            backfill(selected, rank(dedup(allCandidates)), window.min());
        }

        List<String> finalSet = selected.stream().map(HashtagCandidate::tag).toList();
        log.debug("Day {} {}: {} keywords, {} candidates, final {}",
                day, platform, keywords.size(), allCandidates.size(), finalSet);

        ComplianceReport compliance = optimizer.check(finalSet, platform, industryText);
        if (!compliance.overallCompliance()) {
            log.debug("Day {} {}: final set is not fully compliant: {}", day, platform, compliance);
        }

        return new HashtagRecommendation(day, platform, keywords, finalSet, breakdown, allCandidates,
                compliance, null);
    }

    // ==================================================================================
    // Helpers
    // ==================================================================================

    /** Half-up rounding; popular and niche get at least one slot. */
    static Map<String, Integer> quotas(int max) {
        Map<String, Integer> quotas = new LinkedHashMap<>();
        quotas.put(POPULAR, Math.max(1, (int) Math.round(max * 0.3)));
        quotas.put(NICHE, Math.max(1, (int) Math.round(max * 0.5)));
        quotas.put(BRANDED, (int) Math.round(max * 0.1));
        quotas.put(CONTENT_SPECIFIC, (int) Math.round(max * 0.1));
        return quotas;
    }

    static int relevance(String tag, List<String> keywords) {
        String clean = tag.replace("#", "").toLowerCase(Locale.ROOT);
        if (clean.isEmpty()) {
            return 0;
        }
        int score = 0;
        for (String keyword : keywords) {
            String lowered = keyword.toLowerCase(Locale.ROOT);
            if (clean.contains(lowered) || lowered.contains(clean)) {
                score++;
            }
        }
        return score;
    }

    private static List<HashtagCandidate> score(List<String> tags, HashtagSource source, List<String> keywords) {
        return tags.stream()
                .map(tag -> new HashtagCandidate(tag, source, relevance(tag, keywords)))
                .toList();
    }

    private static List<HashtagCandidate> allowed(List<HashtagCandidate> candidates, PlatformHashtagRules rules,
                                                  String category) {
        List<HashtagCandidate> allowed = candidates.stream()
                .filter(candidate -> !rules.isAvoided(candidate.tag()))
                .toList();
        if (allowed.size() < candidates.size()) {
            log.debug("{}: dropped {} {} candidate(s) on the avoid list",
                    rules.platform(), candidates.size() - allowed.size(), category);
        }
        return allowed;
    }

    @SafeVarargs
    private static List<HashtagCandidate> concat(List<HashtagCandidate>... pools) {
        List<HashtagCandidate> all = new ArrayList<>();
        for (List<HashtagCandidate> pool : pools) {
            all.addAll(pool);
        }
        return all;
    }

    /** Case-insensitive, first occurrence wins. */
    static List<HashtagCandidate> dedup(List<HashtagCandidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<HashtagCandidate> unique = new ArrayList<>();
        for (HashtagCandidate candidate : candidates) {
            if (seen.add(candidate.tag().toLowerCase(Locale.ROOT))) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    /** Stable sort by score, highest first. */
    static List<HashtagCandidate> rank(List<HashtagCandidate> candidates) {
        List<HashtagCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingInt(HashtagCandidate::relevanceScore).reversed());
        return ranked;
    }

    private static void backfill(List<HashtagCandidate> selected, List<HashtagCandidate> ranked, int min) {
        Set<String> chosen = new HashSet<>();
        selected.forEach(candidate -> chosen.add(candidate.tag().toLowerCase(Locale.ROOT)));
        for (HashtagCandidate candidate : ranked) {
            if (selected.size() >= min) {
                return;
            }
            if (chosen.add(candidate.tag().toLowerCase(Locale.ROOT))) {
                selected.add(candidate);
            }
        }
    }

    /** Trims, adds the leading '#', drops tags without a letter or digit. */
    static List<String> normalize(List<String> brandedTags) {
        List<String> normalized = new ArrayList<>();
        for (String tag : brandedTags) {
            if (tag == null || !HAS_WORD_CHARACTER.matcher(tag).find()) {
                if (tag != null && !tag.isBlank()) {
                    log.debug("Ignoring branded hashtag without letters or digits: '{}'", tag);
                }
                continue;
            }
            String trimmed = tag.trim();
            normalized.add(trimmed.startsWith("#") ? trimmed : "#" + trimmed);
        }
        return normalized;
    }
}
