package com.eainde.planner.hashtag;

import com.eainde.planner.model.Platform;
import com.eainde.planner.rules.KeywordRuleTable;

import java.util.List;
import java.util.Map;

/**
 * Static hashtag tables for the candidate pools.
 */
final class HashtagCatalog {

    static final List<String> GENERAL_TRENDING =
            List.of("#business", "#marketing", "#entrepreneur", "#growth", "#success");

    static final KeywordRuleTable<List<String>> INDUSTRY_TRENDING = KeywordRuleTable.<List<String>>builder()
            .rule(List.of("#tech", "#innovation", "#digital", "#software"), "technology")
            .rule(List.of("#healthcare", "#health", "#wellness", "#medical"), "healthcare")
            .rule(List.of("#ecommerce", "#retail", "#online", "#shopping"), "e-commerce")
            .build();

    static final List<String> DEFAULT_INDUSTRY_TRENDING = List.of("#business", "#professional", "#industry");

    static final Map<Platform, List<String>> PLATFORM_TRENDING = Map.of(
            Platform.FACEBOOK, List.of("#business", "#community"),
            Platform.INSTAGRAM, List.of("#business", "#entrepreneur", "#marketing"),
            Platform.LINKEDIN, List.of("#business", "#professional", "#career"));

    static final KeywordRuleTable<TagTiers> INDUSTRY = KeywordRuleTable.<TagTiers>builder()
            .rule(TagTiers.of(
                    List.of("#tech", "#technology", "#innovation", "#digital", "#software"),
                    List.of("#startup", "#SaaS", "#AI", "#automation", "#cloud"),
                    List.of("#techtrends", "#digitaltransformation", "#techinnovation", "#softwaredevelopment")),
                    "technology")
            .rule(TagTiers.of(
                    List.of("#healthcare", "#health", "#medical", "#wellness", "#medicine"),
                    List.of("#patientcare", "#healthtech", "#medicalinnovation", "#wellness", "#fitness"),
                    List.of("#healthcareinnovation", "#digitalhealth", "#telemedicine", "#healthtech")),
                    "healthcare")
            .rule(TagTiers.of(
                    List.of("#ecommerce", "#retail", "#online", "#shopping", "#business"),
                    List.of("#onlinestore", "#digitalcommerce", "#retailtech", "#customerservice"),
                    List.of("#ecommercegrowth", "#onlineretail", "#digitalretail", "#ecommercetips")),
                    "e-commerce")
            .rule(TagTiers.of(
                    List.of("#finance", "#fintech", "#banking", "#investment", "#money"),
                    List.of("#financialplanning", "#wealthmanagement", "#fintechinnovation", "#bankingtech"),
                    List.of("#financialfreedom", "#investing", "#personalfinance", "#fintech")),
                    "finance")
            .rule(TagTiers.of(
                    List.of("#education", "#learning", "#teaching", "#training", "#knowledge"),
                    List.of("#edtech", "#onlinelearning", "#professionaldevelopment", "#skills"),
                    List.of("#educationinnovation", "#digitallearning", "#skilldevelopment", "#lifelonglearning")),
                    "education")
            .build();

    static final TagTiers DEFAULT_INDUSTRY = TagTiers.of(
            List.of("#business", "#professional", "#industry", "#growth", "#success"),
            List.of("#entrepreneur", "#leadership", "#strategy", "#innovation", "#marketing"),
            List.of("#businessgrowth", "#professionaldevelopment", "#industryinsights", "#businessstrategy"));

    static final KeywordRuleTable<TagTiers> AUDIENCE = KeywordRuleTable.<TagTiers>builder()
            .rule(TagTiers.of(
                    List.of("#professional", "#career", "#leadership", "#business", "#networking"),
                    List.of("#professionaldevelopment", "#careergrowth", "#businessnetworking", "#leadership"),
                    List.of("#executivecoaching", "#businessstrategy", "#professionalgrowth", "#careeradvancement")),
                    "professional", "business", "executive")
            .rule(TagTiers.of(
                    List.of("#entrepreneur", "#startup", "#businessowner", "#smallbusiness", "#hustle"),
                    List.of("#entrepreneurlife", "#startuplife", "#businessgrowth", "#entrepreneurmindset"),
                    List.of("#startupjourney", "#entrepreneurial", "#businessbuilding", "#startupgrowth")),
                    "entrepreneur", "startup", "small business")
            .rule(TagTiers.of(
                    List.of("#student", "#learning", "#education", "#study", "#knowledge"),
                    List.of("#studentlife", "#academic", "#studytips", "#learning", "#education"),
                    List.of("#studymotivation", "#academiclife", "#learningjourney", "#education")),
                    "student", "learner", "education")
            .build();

    static final TagTiers GENERAL_AUDIENCE = TagTiers.of(
            List.of("#business", "#growth", "#success", "#motivation", "#inspiration"),
            List.of("#businessgrowth", "#personalgrowth", "#successmindset", "#motivation"),
            List.of("#businessinsights", "#growthmindset", "#successstory", "#motivation"));

    static final KeywordRuleTable<List<String>> AGE_GROUP_NICHE = KeywordRuleTable.<List<String>>builder()
            .rule(List.of("#millennialbusiness", "#youngprofessionals"), "25-45", "millennial", "young")
            .rule(List.of("#experiencedleaders", "#seasonedprofessionals"), "45+", "senior", "mature")
            .build();

    static final Map<Platform, List<String>> PLATFORM_BEST_PRACTICE = Map.of(
            Platform.FACEBOOK, List.of("#business", "#community", "#local"),
            Platform.INSTAGRAM, List.of("#business", "#entrepreneur", "#marketing", "#industry"),
            Platform.LINKEDIN, List.of("#business", "#professional", "#industry", "#career"));

    private HashtagCatalog() {}

    static TagTiers industryTiers(String industry) {
        return INDUSTRY.firstMatchOrDefault(industry, DEFAULT_INDUSTRY);
    }

    static TagTiers audienceTiers(String audience) {
        return AUDIENCE.firstMatchOrDefault(audience, GENERAL_AUDIENCE);
    }

    static List<String> ageNiche(String audience) {
        return AGE_GROUP_NICHE.firstMatchOrDefault(audience, List.of());
    }

    static List<String> industryTrending(String industry) {
        return INDUSTRY_TRENDING.firstMatchOrDefault(industry, DEFAULT_INDUSTRY_TRENDING);
    }
}
