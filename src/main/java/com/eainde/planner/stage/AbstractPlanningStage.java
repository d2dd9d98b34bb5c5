package com.eainde.planner.stage;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.context.GateDecision;
import com.eainde.planner.context.StageGate;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Base class for all planning stages.
 *
 * <h3>Lifecycle of {@link #execute(ContextStore, Object)}:</h3>
 * <ol>
 *   <li>{@link StageGate} checks {@link #requiredKeys(Object)}; a closed gate returns a
 *       MissingArtifact result before anything is computed.</li>
 *   <li>{@link #process(ContextStore, Object)} computes the stage output from committed
 *       artifacts only. It signals bad input with {@link ValidationException}.</li>
 *   <li>The buffered writes are committed in one call. A failing stage writes nothing.</li>
 * </ol>
 *
 * @param <I> stage input (use {@link Void} for stages that read only the store)
 * @param <O> produced artifact
 */
@Log4j2
public abstract class AbstractPlanningStage<I, O> {

    /**
     * Runs the stage against the store and returns a tagged result.
     * Structured failures never escape as exceptions.
     */
    public final StageResult<O> execute(ContextStore store, I input) {
        List<ArtifactKey<?>> required;
        try {
            required = requiredKeys(input);
        } catch (PlanningException e) {
            log.warn("{} rejected input: {}", name(), e.getMessage());
            return StageResult.failure(name(), e);
        }

        GateDecision gate = StageGate.check(store, required);
        if (!gate.open()) {
            log.warn("{} gate closed, missing {}", name(), gate.missing());
            return StageResult.missingArtifact(name(), gate.missing());
        }

        StageOutput<O> output;
        try {
            output = process(store, input);
        } catch (PlanningException e) {
            log.warn("{} rejected input: {}", name(), e.getMessage());
            return StageResult.failure(name(), e);
        }

        store.commit(name(), output.getWrites());
        log.info("{} complete: {}", name(), output.getMessage());
        return StageResult.success(name(), output.getMessage(), output.getData());
    }

    public final StageResult<O> execute(ContextStore store) {
        return execute(store, null);
    }

    /** Stage name, also the owner of the keys it writes. */
    public abstract String name();

    protected abstract List<ArtifactKey<?>> requiredKeys(I input);

    protected abstract StageOutput<O> process(ContextStore store, I input);
}
