package com.example.dfasim.cli;

import com.example.dfasim.SimulationResult;
import com.example.dfasim.TraceStep;

import java.util.*;

/**
 * Renders simulation traces and enumeration results as text lines.
 */
public final class TraceFormatter {

    static final String EMPTY_STRING = "(empty string)";
    static final String NO_STRINGS = "No accepted strings found (limit reached or empty language).";

    private TraceFormatter() {}

    public static List<String> formatRun(String input, SimulationResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("Evaluating: \"" + input + "\"");
        if (result.getTrace().isEmpty() && input.isEmpty()) {
            lines.add(EMPTY_STRING);
        }
        for (TraceStep step : result.getTrace()) {
            if (step.isStalled()) {
                lines.add(step.getPosition() + ". From state (" + step.getFromState() + ") with symbol '"
                    + step.getSymbol() + "' there is no transition -> REJECTED");
                lines.add("Result: REJECTED");
                return lines;
            }
            lines.add(step.getPosition() + ". From state (" + step.getFromState() + ") with symbol '"
                + step.getSymbol() + "' go to state (" + step.getToState() + ").");
        }
        lines.add("Finished. Final state is (" + result.getFinalState() + ").");
        lines.add("Result: " + (result.isAccepted() ? "ACCEPTED" : "REJECTED"));
        return lines;
    }

    public static List<String> formatAccepted(List<String> strings, int maxResults) {
        List<String> lines = new ArrayList<>();
        if (strings.isEmpty()) {
            lines.add(NO_STRINGS);
        }
        for (String s : strings) {
            lines.add(s.isEmpty() ? EMPTY_STRING : s);
        }
        lines.add("Generated " + strings.size() + " strings (max " + maxResults + ").");
        return lines;
    }
}
