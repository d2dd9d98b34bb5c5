package com.eainde.planner.model;

import com.eainde.planner.stage.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashtagWindowTest {

    @Test
    @DisplayName("parses the first N-M range in guidance text")
    void parse() {
        assertThat(HashtagWindow.parse("Use 8-12 hashtags including trending ones")).contains(new HashtagWindow(8, 12));
        assertThat(HashtagWindow.parse("Use a few hashtags")).isEmpty();
        assertThat(HashtagWindow.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("intersection is empty for disjoint windows")
    void intersect() {
        HashtagWindow instagram = new HashtagWindow(5, 15);

        assertThat(instagram.intersect(new HashtagWindow(10, 20))).contains(new HashtagWindow(10, 15));
        assertThat(instagram.intersect(new HashtagWindow(1, 3))).isEmpty();
    }

    @Test
    @DisplayName("rejects an inverted window")
    void inverted() {
        assertThatThrownBy(() -> new HashtagWindow(4, 2)).isInstanceOf(ValidationException.class);
    }
}
