package com.eainde.planner.intake;

import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.PlatformSelection;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * The three validated input artifacts of a run.
 */
public record PlanningInputs(
        @JsonProperty("business_profile")   BusinessProfile business,
        @JsonProperty("brand_profile")      BrandProfile brand,
        @JsonProperty("platform_selection") PlatformSelection platforms
) implements Serializable {}
