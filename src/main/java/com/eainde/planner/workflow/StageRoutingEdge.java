package com.eainde.planner.workflow;

import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Continues to the next node unless the node that just ran failed.
 */
@Component
public class StageRoutingEdge implements AsyncEdgeAction<PlanningState> {

    public static final String NEXT = "next";
    public static final String HALT = "halt";

    @Override
    public CompletableFuture<String> apply(PlanningState state) {
        String route = state.isFailed() ? HALT : NEXT;
        return CompletableFuture.completedFuture(route);
    }
}
