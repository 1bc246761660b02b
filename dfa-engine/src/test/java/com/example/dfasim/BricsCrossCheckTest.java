package com.example.dfasim;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.SpecialOperations;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compares simulation and enumeration with dk.brics.automaton on the same DFAs.
 */
class BricsCrossCheckTest {

    private static final int MAX_LENGTH = 6;

    private static Automaton toBrics(Dfa dfa) {
        State[] states = new State[dfa.stateCount()];
        for (int q = 0; q < states.length; q++) {
            states[q] = new State();
            states[q].setAccept(dfa.isAccepting(q));
        }
        for (int q = 0; q < states.length; q++) {
            for (int s = 0; s < dfa.symbolCount(); s++) {
                int next = dfa.next(q, s);
                if (next != Dfa.NO_STATE) {
                    states[q].addTransition(new Transition(dfa.symbol(s).charAt(0), states[next]));
                }
            }
        }
        Automaton automaton = new Automaton();
        automaton.setInitialState(states[dfa.initialState()]);
        automaton.setDeterministic(true);
        return automaton;
    }

    private static List<String> allStrings(List<String> alphabet, int maxLength) {
        List<String> words = new ArrayList<>();
        List<String> layer = List.of("");
        for (int length = 0; length <= maxLength; length++) {
            words.addAll(layer);
            List<String> nextLayer = new ArrayList<>();
            for (String word : layer) {
                for (String symbol : alphabet) {
                    nextLayer.add(word + symbol);
                }
            }
            layer = nextLayer;
        }
        return words;
    }

    private static List<Dfa> samples() {
        DfaDefinition partial = SampleAutomata.endsWith01();
        partial.setTransitions(null);
        partial.putTransition("q0", "0", "q1");
        partial.putTransition("q1", "1", "q2");
        partial.putTransition("q2", "0", "q1");
        return List.of(
            SampleAutomata.applied(SampleAutomata.parity()),
            SampleAutomata.applied(SampleAutomata.atLeastOne1()),
            SampleAutomata.applied(SampleAutomata.endsWith01()),
            SampleAutomata.applied(partial));
    }

    @Test
    void acceptanceAgrees() throws InvalidInputException {
        for (Dfa dfa : samples()) {
            Automaton reference = toBrics(dfa);
            for (String word : allStrings(dfa.definition().getAlphabet(), MAX_LENGTH)) {
                assertEquals(reference.run(word), Simulator.run(dfa, word).isAccepted(), word);
            }
        }
    }

    @Test
    void enumerationFindsEveryStringOfEachLength() {
        for (Dfa dfa : samples()) {
            Automaton reference = toBrics(dfa);
            List<String> found = LanguageEnumerator.enumerateAccepted(dfa, Integer.MAX_VALUE, MAX_LENGTH);
            for (int length = 0; length <= MAX_LENGTH; length++) {
                Set<String> ofLength = new HashSet<>();
                for (String word : found) {
                    if (word.length() == length) {
                        ofLength.add(word);
                    }
                }
                assertEquals(SpecialOperations.getStrings(reference, length), ofLength, "length " + length);
            }
        }
    }
}
