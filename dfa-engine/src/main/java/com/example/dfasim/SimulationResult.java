package com.example.dfasim;

import java.util.*;

/**
 * Outcome of running one input through a {@link Dfa}.
 */
public final class SimulationResult {

    private final List<TraceStep> trace;
    private final boolean accepted;
    private final String finalState;

    public SimulationResult(List<TraceStep> trace, boolean accepted, String finalState) {
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.accepted = accepted;
        this.finalState = finalState;
    }

    public List<TraceStep> getTrace() { return trace; }
    public boolean isAccepted() { return accepted; }

    /**
     * @return the state the run ended in, or {@code null} if it stalled on a
     *         missing transition or there was no initial state
     */
    public String getFinalState() { return finalState; }

    /**
     * @return true if the run stopped early on an undefined transition
     */
    public boolean isStalled() {
        return !trace.isEmpty() && trace.get(trace.size() - 1).isStalled();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationResult)) return false;
        SimulationResult that = (SimulationResult) o;
        return accepted == that.accepted && trace.equals(that.trace) && Objects.equals(finalState, that.finalState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trace, accepted, finalState);
    }

    @Override
    public String toString() {
        return "SimulationResult{accepted=" + accepted + ", trace=" + trace + "}";
    }
}
