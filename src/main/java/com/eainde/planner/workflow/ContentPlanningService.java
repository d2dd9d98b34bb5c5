package com.eainde.planner.workflow;

import com.eainde.planner.model.PlanningRequest;
import com.eainde.planner.stage.ResultStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for planning a week of content.
 * <p>
 * Facade over the compiled planning graph: assigns the run id, puts it on the MDC so
 * every stage log line carries it, runs the graph and turns the final state into a
 * {@link PlanningOutcome}.
 * </p>
 */
@Log4j2
@Service
public class ContentPlanningService {

    static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<PlanningState> workflow;

    public ContentPlanningService(@Qualifier("contentPlanningWorkflow") CompiledGraph<PlanningState> workflow) {
        this.workflow = workflow;
    }

    public PlanningOutcome plan(PlanningRequest request) {
        String runId = request != null && request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : UUID.randomUUID().toString();

        MDC.put(MDC_RUN_ID, runId);
        try {
            log.info("Planning run started");

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            // Map.of rejects null values; a missing request is reported by the intake node
            Map<String, Object> inputs = request == null
                    ? Map.of(PlanningState.RUN_ID, runId)
                    : Map.of(PlanningState.RUN_ID, runId, PlanningState.REQUEST, request);

            PlanningState state = workflow.invoke(inputs, config)
                    .orElseThrow(() -> new IllegalStateException("Planning graph returned no state for run " + runId));

            PlanningOutcome outcome = new PlanningOutcome(
                    runId,
                    state.isFailed() ? ResultStatus.ERROR : ResultStatus.SUCCESS,
                    state.getLastMessage(),
                    state.getFailedStage().orElse(null),
                    state.toStore().snapshot());

            log.info("Planning run finished with status {} ({} artifacts)",
                    outcome.status().getLabel(), outcome.artifacts().size());
            return outcome;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }
}
