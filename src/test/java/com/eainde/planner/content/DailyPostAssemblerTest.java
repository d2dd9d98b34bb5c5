package com.eainde.planner.content;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.strategy.StrategyBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailyPostAssemblerTest {

    @Mock private RandomSource random;

    private ContextStore store;
    private StrategyFramework framework;

    @BeforeEach
    void setUp() {
        store = PlanningFixtures.storeWithInputs("LinkedIn", "Instagram");
        new StrategyBuilder().execute(store);
        framework = store.require(ArtifactKeys.STRATEGY_FRAMEWORK);
    }

    private static DailyPostRequest request(int day, Platform platform) {
        return DailyPostRequest.builder()
                .day(day)
                .theme("Educational Content")
                .postType("Article")
                .targetAudience("Business professionals, founders")
                .brandVoice("Professional")
                .platform(platform)
                .build();
    }

    private DailyPostAssembler assembler(long seed) {
        return new DailyPostAssembler(new RandomSourceFactory(seed), PlanningFixtures.FIXED_CLOCK);
    }

    @Nested
    @DisplayName("assemble()")
    class Assemble {

        @Test
        @DisplayName("draws title, hook and call to action from the random source")
        void drawsThreeTemplates() {
            when(random.nextIndex(anyInt())).thenReturn(0);
            doCallRealMethod().when(random).pick(anyList());

            DailyPost post = assembler(1).assemble(request(1, Platform.LINKEDIN),
                    PlanningFixtures.business(), PlanningFixtures.brand(), framework, random);

            verify(random, times(3)).nextIndex(anyInt());
            assertThat(post.title()).isEqualTo("How Your Industry Professionals Can Stay Informed");
            assertThat(post.caption()).startsWith("Did you know that...")
                    .endsWith("What are your thoughts on this? Share your experience in the comments below.");
            assertThat(post.goal()).isEqualTo("Educate audience about industry topics and establish thought leadership");
            assertThat(post.timestamp()).isEqualTo(Instant.parse("2026-01-05T09:00:00Z"));
        }

        @Test
        @DisplayName("Instagram captions put each sentence on its own paragraph")
        void instagramCaption() {
            when(random.nextIndex(anyInt())).thenReturn(0);
            doCallRealMethod().when(random).pick(anyList());

            DailyPost post = assembler(1).assemble(request(3, Platform.INSTAGRAM),
                    PlanningFixtures.business(), PlanningFixtures.brand(), framework, random);

            assertThat(post.caption()).contains(".\n\nHere are three key insights");
            assertThat(post.dayName()).isEqualTo("Wednesday");
        }
    }

    @Nested
    @DisplayName("execute()")
    class Execute {

        @Test
        @DisplayName("the same seed and clock produce the same post")
        void reproducible() {
            ContextStore other = PlanningFixtures.storeWithInputs("LinkedIn", "Instagram");
            new StrategyBuilder().execute(other);

            DailyPost first = assembler(42).execute(store, request(5, Platform.LINKEDIN)).data();
            DailyPost second = assembler(42).execute(other, request(5, Platform.LINKEDIN)).data();

            assertThat(first).isEqualTo(second);
            assertThat(store.get(ArtifactKeys.dailyPost(5))).contains(first);
        }

        @Test
        @DisplayName("day names follow the Monday-start week")
        void dayNames() {
            String[] expected = {"Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"};
            DailyPostAssembler assembler = assembler(7);
            for (int day = 1; day <= 7; day++) {
                assertThat(assembler.execute(store, request(day, Platform.LINKEDIN)).data().dayName())
                        .isEqualTo(expected[day - 1]);
            }
        }

        @Test
        @DisplayName("a platform outside the selection is a ValidationError")
        void unselectedPlatform() {
            StageResult<DailyPost> result = assembler(1).execute(store, request(2, Platform.FACEBOOK));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(store.contains(ArtifactKeys.dailyPost(2))).isFalse();
        }

        @Test
        @DisplayName("a blank theme is a ValidationError")
        void blankTheme() {
            DailyPostRequest blank = DailyPostRequest.builder()
                    .day(1).theme(" ").postType("Article").targetAudience("Anyone")
                    .brandVoice("Calm").platform(Platform.LINKEDIN).build();

            assertThat(assembler(1).execute(store, blank).errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("a missing platform is a ValidationError and writes nothing")
        void missingPlatform() {
            StageResult<DailyPost> result = assembler(1).execute(store, request(4, null));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(result.message()).isEqualTo("Field 'platform' must not be empty");
            assertThat(store.contains(ArtifactKeys.dailyPost(4))).isFalse();
        }

        @Test
        @DisplayName("a missing strategy closes the gate")
        void missingStrategy() {
            StageResult<DailyPost> result = assembler(1).execute(
                    PlanningFixtures.storeWithInputs("LinkedIn"), request(1, Platform.LINKEDIN));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_ARTIFACT);
            assertThat(result.missingKeys()).containsExactly("strategy_framework");
        }
    }
}
