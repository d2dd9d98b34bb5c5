package com.eainde.planner.hashtag;

import java.util.List;

/**
 * Hashtags of one category split by reach: primary (broad) to niche (targeted).
 */
record TagTiers(List<String> primary, List<String> secondary, List<String> niche) {

    static TagTiers of(List<String> primary, List<String> secondary, List<String> niche) {
        return new TagTiers(List.copyOf(primary), List.copyOf(secondary), List.copyOf(niche));
    }
}
