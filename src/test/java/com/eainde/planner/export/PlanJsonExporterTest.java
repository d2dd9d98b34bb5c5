package com.eainde.planner.export;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.calendar.CalendarAssembler;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.strategy.StrategyBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanJsonExporterTest {

    private final PlanJsonExporter exporter = new PlanJsonExporter();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("renders store artifacts with snake_case names and ISO timestamps")
    void storeSnapshot() throws Exception {
        ContextStore store = PlanningFixtures.storeWithInputs("Instagram");
        new StrategyBuilder().execute(store);
        new CalendarAssembler(PlanningFixtures.FIXED_CLOCK).execute(store);

        JsonNode json = reader.readTree(exporter.toJson(store));

        assertThat(json.path("strategy_framework").path("content_mix").path("educational").asInt()).isEqualTo(40);
        JsonNode monday = json.path("content_calendar").path("daily_posts").get(0);
        assertThat(monday.path("day_name").asText()).isEqualTo("Monday");
        assertThat(monday.path("platform").asText()).isEqualTo("Instagram");
        assertThat(monday.path("timestamp").asText()).isEqualTo("2026-01-05T09:00:00Z");
        assertThat(monday.has("placeholder")).isFalse();
    }

    @Test
    @DisplayName("renders error results with their kind and missing keys")
    void errorResult() throws Exception {
        JsonNode json = reader.readTree(exporter.toJson(
                StageResult.missingArtifact("calendar-assembler", List.of("strategy_framework"))));

        assertThat(json.path("status").asText()).isEqualTo("error");
        assertThat(json.path("error_kind").asText()).isEqualTo("MissingArtifact");
        assertThat(json.path("missing_keys").get(0).asText()).isEqualTo("strategy_framework");
        assertThat(json.has("data")).isFalse();
    }
}
