package com.example.dfasim;

import java.util.Objects;

/**
 * One consumed symbol of a simulation.
 */
public final class TraceStep {

    private final int position;
    private final String fromState;
    private final String symbol;
    private final String toState;

    public TraceStep(int position, String fromState, String symbol, String toState) {
        this.position = position;
        this.fromState = fromState;
        this.symbol = symbol;
        this.toState = toState;
    }

    /** 1-based index of the symbol in the input. */
    public int getPosition() { return position; }
    public String getFromState() { return fromState; }
    public String getSymbol() { return symbol; }

    /**
     * @return the state reached, or {@code null} if no transition was defined
     */
    public String getToState() { return toState; }

    public boolean isStalled() { return toState == null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceStep)) return false;
        TraceStep that = (TraceStep) o;
        return position == that.position
            && Objects.equals(fromState, that.fromState)
            && symbol.equals(that.symbol)
            && Objects.equals(toState, that.toState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, fromState, symbol, toState);
    }

    @Override
    public String toString() {
        return "{" + position + ", " + fromState + ", '" + symbol + "', " + toState + "}";
    }
}
