package com.eainde.planner.context;

import java.util.List;

/**
 * Outcome of a {@link StageGate} check.
 *
 * @param open    true when every required key is present
 * @param missing names of the absent keys, in the order they were required
 */
public record GateDecision(boolean open, List<String> missing) {

    private static final GateDecision OK = new GateDecision(true, List.of());

    public GateDecision {
        missing = List.copyOf(missing);
    }

    public static GateDecision ok() {
        return OK;
    }

    public static GateDecision missing(List<String> keys) {
        return new GateDecision(false, keys);
    }
}
