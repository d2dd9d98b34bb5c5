package com.eainde.planner.export;

import com.eainde.planner.context.ContextStore;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.workflow.PlanningOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Renders planning results as pretty-printed JSON with snake_case field names and
 * ISO-8601 timestamps.
 */
@Component
public class PlanJsonExporter {

    private final ObjectMapper mapper;

    public PlanJsonExporter() {
        this(new ObjectMapper());
    }

    @Autowired
    public PlanJsonExporter(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(PlanningOutcome outcome) {
        return write(outcome);
    }

    public String toJson(StageResult<?> result) {
        return write(result);
    }

    public String toJson(ContextStore store) {
        return write(store.snapshot());
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
