package com.eainde.planner.workflow;

import com.eainde.planner.context.ContextStore;
import com.eainde.planner.stage.StageResult;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Graph node running one pipeline step against the committed artifacts.
 * Returns only what the step wrote, plus its status.
 */
@Log4j2
public class StageNode implements AsyncNodeAction<PlanningState> {

    private final String stage;
    private final BiFunction<ContextStore, PlanningState, StageResult<?>> step;

    public StageNode(String stage, BiFunction<ContextStore, PlanningState, StageResult<?>> step) {
        this.stage = stage;
        this.step = step;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(PlanningState state) {
        ContextStore store = state.toStore();
        StageResult<?> result = step.apply(store, state);

        Map<String, Object> updates = new LinkedHashMap<>(store.writtenSinceCreation());
        updates.put(PlanningState.LAST_STAGE, stage);
        updates.put(PlanningState.LAST_STATUS, result.status().getLabel());
        updates.put(PlanningState.LAST_MESSAGE, result.message());
        if (!result.isSuccess()) {
            log.warn("Run {} stopped at {}: {}", state.getRunId(), stage, result.message());
            updates.put(PlanningState.FAILED_STAGE, stage);
        }
        return CompletableFuture.completedFuture(updates);
    }

    public String getStage() {
        return stage;
    }
}
