package com.example.dfasim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs input strings through a {@link Dfa}, recording every step.
 */
public final class Simulator {

    private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

    private Simulator() {}

    /**
     * Runs a string, consuming one code point per step.
     */
    public static SimulationResult run(Dfa dfa, String input) throws InvalidInputException {
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return run(dfa, symbols);
    }

    /**
     * Runs a sequence of symbols.
     *
     * <p>Every symbol is checked against the alphabet before the first step,
     * so an invalid input never produces a partial trace. A missing transition
     * ends the run with a stalled step and a rejection.
     *
     * @throws InvalidInputException if a symbol is not in the alphabet
     */
    public static SimulationResult run(Dfa dfa, List<String> input) throws InvalidInputException {
        int[] encoded = new int[input.size()];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = dfa.symbolIndex(input.get(i));
            if (encoded[i] == Dfa.NO_STATE) {
                throw new InvalidInputException(input.get(i), i + 1);
            }
        }

        List<TraceStep> trace = new ArrayList<>(encoded.length);
        int current = dfa.initialState();
        for (int i = 0; i < encoded.length; i++) {
            String from = current == Dfa.NO_STATE ? null : dfa.stateName(current);
            int next = dfa.next(current, encoded[i]);
            if (next == Dfa.NO_STATE) {
                trace.add(new TraceStep(i + 1, from, input.get(i), null));
                logger.trace("Step {}: no transition from {} on '{}'", i + 1, from, input.get(i));
                return new SimulationResult(trace, false, null);
            }
            trace.add(new TraceStep(i + 1, from, input.get(i), dfa.stateName(next)));
            logger.trace("Step {}: {} --{}--> {}", i + 1, from, input.get(i), dfa.stateName(next));
            current = next;
        }

        String finalState = current == Dfa.NO_STATE ? null : dfa.stateName(current);
        return new SimulationResult(trace, dfa.isAccepting(current), finalState);
    }
}
