package com.eainde.planner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Raw, unvalidated inputs for one planning run, as handed over by the caller.
 * The intake stage turns them into the three profile artifacts.
 */
@Value
@Builder
public class PlanningRequest implements Serializable {

    String runId;

    // Business
    String industry;
    String targetAudience;
    String businessGoals;
    String currentChallenges;

    // Brand
    String brandVoice;
    String brandTone;
    String coreValues;
    String personalityAdjectives;

    // Platforms
    @Singular
    List<String> platforms;
    String platformPriorities;

    /** Custom hashtags of the business, with or without the leading '#'. */
    @Singular
    List<String> brandedHashtags;

    /** Free text with up to three hex colours, e.g. "Primary: #1E40AF, Secondary: #F59E0B". */
    String brandColors;
}
