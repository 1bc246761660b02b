package com.example.dfasim.cli;

import com.example.dfasim.DfaDefinition;
import com.example.dfasim.InvalidDefinitionException;
import com.example.dfasim.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonSessionTest {

    @Test
    void nothingAppliedRefusesToRun() {
        AutomatonSession session = new AutomatonSession();
        assertFalse(session.isDefined());
        assertThrows(IllegalStateException.class, () -> session.run("0"));
        assertThrows(IllegalStateException.class, () -> session.enumerate(10, 20));
    }

    @Test
    void emptyAutomatonCountsAsUndefined() throws InvalidDefinitionException {
        AutomatonSession session = new AutomatonSession();
        session.apply(new DfaDefinition());
        assertTrue(session.current().isPresent());
        assertFalse(session.isDefined());
        assertThrows(IllegalStateException.class, () -> session.run(""));
    }

    @Test
    void rejectedDefinitionKeepsPrevious() throws InvalidDefinitionException, InvalidInputException {
        AutomatonSession session = new AutomatonSession();
        session.apply(ExampleAutomata.get("Even number of 1s").get());

        DfaDefinition broken = ExampleAutomata.get("At least one 1").get();
        broken.setAcceptingStates(List.of("q5"));
        assertThrows(InvalidDefinitionException.class, () -> session.apply(broken));

        assertTrue(session.run("11").isAccepted());
        assertEquals(List.of("", "0"), session.enumerate(2, 20));
    }

    @Test
    void newDefinitionReplacesOld() throws InvalidDefinitionException, InvalidInputException {
        AutomatonSession session = new AutomatonSession();
        session.apply(ExampleAutomata.get("Even number of 1s").get());
        session.apply(ExampleAutomata.get("At least one 1").get());
        assertFalse(session.run("").isAccepted());
        assertTrue(session.run(List.of("0", "1")).isAccepted());
    }
}
