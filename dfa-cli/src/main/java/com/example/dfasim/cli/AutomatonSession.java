package com.example.dfasim.cli;

import com.example.dfasim.Dfa;
import com.example.dfasim.DfaDefinition;
import com.example.dfasim.InvalidDefinitionException;
import com.example.dfasim.InvalidInputException;
import com.example.dfasim.LanguageEnumerator;
import com.example.dfasim.SimulationResult;
import com.example.dfasim.Simulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Holds the automaton the user has currently applied.
 *
 * <p>A definition only replaces the current automaton once it validates;
 * a rejected one leaves the previous automaton in effect.
 */
public class AutomatonSession {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonSession.class);

    private Dfa current;

    /**
     * @throws InvalidDefinitionException if the definition is rejected; the
     *         previously applied automaton is kept
     */
    public Dfa apply(DfaDefinition definition) throws InvalidDefinitionException {
        try {
            current = Dfa.apply(definition);
        } catch (InvalidDefinitionException e) {
            logger.debug("Definition rejected ({}), keeping previous automaton", e.getReason());
            throw e;
        }
        return current;
    }

    public Optional<Dfa> current() {
        return Optional.ofNullable(current);
    }

    public boolean isDefined() {
        return current != null && !current.isEmpty();
    }

    public SimulationResult run(String input) throws InvalidInputException {
        return Simulator.run(requireDefined(), input);
    }

    public SimulationResult run(List<String> input) throws InvalidInputException {
        return Simulator.run(requireDefined(), input);
    }

    public List<String> enumerate(int maxResults, int maxLength) {
        return LanguageEnumerator.enumerateAccepted(requireDefined(), maxResults, maxLength);
    }

    private Dfa requireDefined() {
        if (!isDefined()) {
            throw new IllegalStateException("No automaton defined: apply a definition with at least one state first");
        }
        return current;
    }
}
