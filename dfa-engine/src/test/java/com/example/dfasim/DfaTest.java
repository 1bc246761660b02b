package com.example.dfasim;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DfaTest {

    @Test
    void invalidDefinitionIsNotApplied() {
        DfaDefinition d = SampleAutomata.parity();
        d.setInitialState("q3");
        assertThrows(InvalidDefinitionException.class, () -> Dfa.apply(d));
    }

    @Test
    void tableFollowsDefinition() {
        Dfa dfa = SampleAutomata.applied(SampleAutomata.endsWith01());
        assertEquals(3, dfa.stateCount());
        assertEquals(2, dfa.symbolCount());
        assertEquals("q0", dfa.stateName(dfa.initialState()));

        int q1 = dfa.next(dfa.initialState(), dfa.symbolIndex("0"));
        assertEquals("q1", dfa.stateName(q1));
        int q2 = dfa.next(q1, dfa.symbolIndex("1"));
        assertTrue(dfa.isAccepting(q2));
        assertFalse(dfa.isAccepting(q1));
    }

    @Test
    void missingTransitionIsSentinel() {
        Dfa dfa = SampleAutomata.applied(SampleAutomata.stuck());
        assertEquals(Dfa.NO_STATE, dfa.next(dfa.initialState(), dfa.symbolIndex("0")));
        assertEquals(Dfa.NO_STATE, dfa.symbolIndex("7"));
        assertFalse(dfa.inAlphabet("7"));
    }

    @Test
    void snapshotIgnoresLaterEdits() {
        DfaDefinition d = SampleAutomata.parity();
        Dfa dfa = SampleAutomata.applied(d);
        d.putTransition("q0", "1", "q0");
        d.setAcceptingStates(List.of("q1"));

        int q0 = dfa.initialState();
        assertEquals("q1", dfa.stateName(dfa.next(q0, dfa.symbolIndex("1"))));
        assertTrue(dfa.isAccepting(q0));
        assertEquals(SampleAutomata.parity(), dfa.definition());
    }

    @Test
    void repeatedSymbolsKeepFirstPosition() {
        DfaDefinition d = new DfaDefinition(List.of("q0"), List.of("b", "a", "b"), "q0", List.of("q0"), null);
        Dfa dfa = SampleAutomata.applied(d);
        assertEquals(2, dfa.symbolCount());
        assertEquals("b", dfa.symbol(0));
        assertEquals("a", dfa.symbol(1));
    }

    @Test
    void emptyAutomatonHasNoInitialState() {
        Dfa dfa = SampleAutomata.applied(new DfaDefinition());
        assertTrue(dfa.isEmpty());
        assertEquals(Dfa.NO_STATE, dfa.initialState());
        assertFalse(dfa.isAccepting(Dfa.NO_STATE));
    }
}
