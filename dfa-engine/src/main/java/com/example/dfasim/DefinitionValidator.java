package com.example.dfasim;

import com.example.dfasim.InvalidDefinitionException.Reason;

import java.util.*;

/**
 * Structural checks on a {@link DfaDefinition}. Reports the first offending
 * entry found; never modifies the definition.
 */
public final class DefinitionValidator {

    private DefinitionValidator() {}

    public static void validate(DfaDefinition definition) throws InvalidDefinitionException {
        Set<String> states = definition.getStates();

        String initial = definition.getInitialState();
        if (initial != null && !states.contains(initial)) {
            throw new InvalidDefinitionException(Reason.INITIAL_STATE_NOT_IN_STATES, initial,
                "Initial state '" + initial + "' is not in the set of states");
        }

        for (String accepting : definition.getAcceptingStates()) {
            if (!states.contains(accepting)) {
                throw new InvalidDefinitionException(Reason.ACCEPTING_STATES_NOT_SUBSET, accepting,
                    "Accepting state '" + accepting + "' is not in the set of states");
            }
        }

        // Rows are checked one at a time: source, then each symbol and its destination
        Set<String> alphabet = new HashSet<>(definition.getAlphabet());
        for (Map.Entry<String, Map<String, String>> row : definition.getTransitions().entrySet()) {
            String source = row.getKey();
            if (!states.contains(source)) {
                throw new InvalidDefinitionException(Reason.TRANSITION_SOURCE_UNKNOWN, source,
                    "Transition from unknown state '" + source + "'");
            }
            for (Map.Entry<String, String> move : row.getValue().entrySet()) {
                String symbol = move.getKey();
                String target = move.getValue();
                if (!alphabet.contains(symbol)) {
                    throw new InvalidDefinitionException(Reason.SYMBOL_NOT_IN_ALPHABET, symbol,
                        "Symbol '" + symbol + "' in transition from '" + source + "' is not in the alphabet");
                }
                if (!states.contains(target)) {
                    throw new InvalidDefinitionException(Reason.TRANSITION_TARGET_UNKNOWN, target,
                        "Transition (" + source + ", '" + symbol + "') goes to unknown state '" + target + "'");
                }
            }
        }
    }
}
