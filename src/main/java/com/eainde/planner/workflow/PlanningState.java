package com.eainde.planner.workflow;

import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.PlanningRequest;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one planning run: the request, the artifacts committed so far and
 * the outcome of the last node.
 */
public class PlanningState extends AgentState {

    public static final String REQUEST = "request";
    public static final String RUN_ID = "run_id";
    public static final String LAST_STAGE = "last_stage";
    public static final String LAST_STATUS = "last_status";
    public static final String LAST_MESSAGE = "last_message";
    public static final String FAILED_STAGE = "failed_stage";

    public PlanningState(Map<String, Object> initData) {
        super(initData);
    }

    public PlanningRequest getRequest() {
        return this.<PlanningRequest>value(REQUEST).orElse(null);
    }

    public String getRunId() {
        return this.<String>value(RUN_ID).orElse(null);
    }

    public Optional<String> getLastStage() {
        return value(LAST_STAGE);
    }

    public String getLastMessage() {
        return this.<String>value(LAST_MESSAGE).orElse("");
    }

    public Optional<String> getFailedStage() {
        return value(FAILED_STAGE);
    }

    public boolean isFailed() {
        return getFailedStage().isPresent();
    }

    /** Artifacts committed so far, as a fresh store for the next node. */
    public ContextStore toStore() {
        return ContextStore.fromSnapshot(data());
    }
}
