package com.eainde.planner.hashtag;

import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.ComplianceReport;
import com.eainde.planner.model.HashtagWindow;
import com.eainde.planner.model.OptimizedHashtagSet;
import com.eainde.planner.model.Platform;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformHashtagOptimizerTest {

    private final PlatformHashtagOptimizer optimizer = new PlatformHashtagOptimizer();

    private static final List<String> LINKEDIN_CANDIDATES = List.of(
            "#casualfriday", "#personalbranding", "#funfacts", "#entertainment", "#lifestyle",
            "#workfun", "#casualwear", "#personalgrowth", "#lifestyleblog", "#entertainmentindustry",
            "#business", "#professional", "#career", "#leadership", "#networking",
            "#industry", "#technology", "#innovation", "#strategy", "#cloud");

    @Nested
    @DisplayName("count window")
    class Window {

        @Test
        @DisplayName("LinkedIn keeps exactly five tags and drops every avoided one")
        void linkedInTwenty() {
            OptimizedHashtagSet set = optimizer.optimize(
                    new OptimizationRequest(LINKEDIN_CANDIDATES, Platform.LINKEDIN, null, "Technology"));

            assertThat(set.hashtags()).hasSize(5);
            assertThat(set.hashtags()).noneMatch(tag -> tag.matches(".*(casual|personal|fun|entertainment|lifestyle).*"));
            assertThat(set.underFilled()).isFalse();
            assertThat(set.complianceReport().countCompliance().passed()).isTrue();
            assertThat(set.complianceReport().avoidListCompliance().passed()).isTrue();
        }

        @Test
        @DisplayName("the content type narrows the platform window")
        void contentTypeNarrows() {
            OptimizedHashtagSet set = optimizer.optimize(new OptimizationRequest(
                    List.of("#community", "#local", "#business"), Platform.FACEBOOK, "Image Post", "Bakery"));

            assertThat(set.window()).isEqualTo(new HashtagWindow(1, 2));
            assertThat(set.hashtags()).hasSize(2);
        }

        @Test
        @DisplayName("a disjoint content-type range is ignored and noted")
        void disjointRange() {
            OptimizedHashtagSet set = optimizer.optimize(new OptimizationRequest(
                    List.of("#a1", "#b2", "#c3", "#d4", "#e5", "#f6"), Platform.INSTAGRAM, "Story", "Bakery"));

            assertThat(set.window()).isEqualTo(new HashtagWindow(5, 15));
            assertThat(set.notes()).anyMatch(note -> note.contains("outside the platform range"));
        }
    }

    @Nested
    @DisplayName("backfill")
    class Backfill {

        @Test
        @DisplayName("tops up from industry defaults first")
        void industryDefaultsFirst() {
            OptimizedHashtagSet set = optimizer.optimize(
                    new OptimizationRequest(List.of("#cloud"), Platform.LINKEDIN, null, "Technology"));

            assertThat(set.hashtags()).hasSize(3).contains("#cloud", "#tech", "#innovation");
            assertThat(set.underFilled()).isFalse();
        }

        @Test
        @DisplayName("reports under-fill when the defaults run out")
        void underFill() {
            OptimizedHashtagSet set = optimizer.optimize(
                    new OptimizationRequest(List.of("#coffee"), Platform.INSTAGRAM, "Feed Post", "Bakery"));

            assertThat(set.window()).isEqualTo(new HashtagWindow(10, 15));
            assertThat(set.hashtags()).hasSize(6);
            assertThat(set.underFilled()).isTrue();
            assertThat(set.complianceReport().countCompliance().passed()).isFalse();
            assertThat(set.complianceReport().countCompliance().remediation())
                    .isEqualTo("Use between 10 and 15 hashtags");
            assertThat(set.complianceReport().overallCompliance()).isFalse();
        }
    }

    @Nested
    @DisplayName("filtering")
    class Filtering {

        @Test
        @DisplayName("avoided tags are removed and duplicates collapse case-insensitively")
        void avoidAndDedup() {
            OptimizedHashtagSet set = optimizer.optimize(new OptimizationRequest(
                    List.of("#Community", "#community", "#viral"), Platform.FACEBOOK, null, "Bakery"));

            assertThat(set.hashtags()).containsExactly("#Community");
            assertThat(set.notes()).anyMatch(note -> note.contains("avoid list"));
        }

        @Test
        @DisplayName("final order favours the platform's ranking criteria, stable otherwise")
        void platformOrdering() {
            OptimizedHashtagSet set = optimizer.optimize(new OptimizationRequest(
                    List.of("#cloud", "#careernetworking", "#industry"), Platform.LINKEDIN, null, "Bakery"));

            assertThat(set.hashtags()).containsExactly("#careernetworking", "#industry", "#cloud");
        }
    }

    @Nested
    @DisplayName("compliance")
    class Compliance {

        @Test
        @DisplayName("one tag without a platform-appropriate keyword fails appropriateness")
        void oneInappropriateTagFails() {
            ComplianceReport report = optimizer.check(
                    List.of("#business", "#cloud", "#automation"), Platform.LINKEDIN, "Technology");

            assertThat(report.appropriatenessCompliance().passed()).isFalse();
            assertThat(report.appropriatenessCompliance().remediation())
                    .isEqualTo("Replace inappropriate hashtags with platform-suitable alternatives");
            assertThat(report.avoidListCompliance().passed()).isTrue();
            assertThat(report.overallCompliance()).isFalse();
        }

        @Test
        @DisplayName("every tag carrying an appropriate keyword passes appropriateness")
        void allAppropriatePasses() {
            ComplianceReport report = optimizer.check(
                    List.of("#business", "#careergrowth", "#leadership"), Platform.LINKEDIN, "Technology");

            assertThat(report.appropriatenessCompliance().passed()).isTrue();
            assertThat(report.countCompliance().passed()).isTrue();
        }

        @Test
        @DisplayName("an appropriate tag that is also avoided fails both checks")
        void avoidedButAppropriate() {
            ComplianceReport report = optimizer.check(
                    List.of("#personalbusiness", "#business"), Platform.LINKEDIN, "Technology");

            assertThat(report.appropriatenessCompliance().passed()).isFalse();
            assertThat(report.avoidListCompliance().passed()).isFalse();
        }
    }

    @Nested
    @DisplayName("execute()")
    class Execute {

        @Test
        @DisplayName("an empty set is a ValidationError")
        void emptySet() {
            StageResult<OptimizedHashtagSet> result = optimizer.execute(new ContextStore(),
                    new OptimizationRequest(List.of(), Platform.LINKEDIN, null, "Technology"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("a missing platform is a ValidationError")
        void missingPlatform() {
            StageResult<OptimizedHashtagSet> result = optimizer.execute(new ContextStore(),
                    new OptimizationRequest(List.of("#business"), null, null, "Technology"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        }
    }
}
