package com.eainde.planner.hashtag;

import java.io.Serializable;
import java.util.List;

/**
 * @param day          day whose calendar post gets hashtags
 * @param brandedTags  custom hashtags of the business, '#' optional
 */
public record HashtagRequest(int day, List<String> brandedTags) implements Serializable {

    public HashtagRequest {
        brandedTags = brandedTags == null ? List.of() : List.copyOf(brandedTags);
    }
}
