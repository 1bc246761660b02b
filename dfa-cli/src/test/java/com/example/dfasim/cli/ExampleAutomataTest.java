package com.example.dfasim.cli;

import com.example.dfasim.Dfa;
import com.example.dfasim.DfaDefinition;
import com.example.dfasim.InvalidDefinitionException;
import com.example.dfasim.InvalidInputException;
import com.example.dfasim.LanguageEnumerator;
import com.example.dfasim.Simulator;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ExampleAutomataTest {

    @Test
    void catalogHasFourExamplesInOrder() {
        assertEquals(List.of("Even number of 1s", "Ends with 01", "Only zeros", "At least one 1"),
            ExampleAutomata.names());
    }

    @Test
    void everyExampleIsValid() {
        for (String name : ExampleAutomata.names()) {
            assertDoesNotThrow(() -> Dfa.apply(ExampleAutomata.get(name).get()), name);
        }
    }

    @Test
    void examplesAreCopies() {
        DfaDefinition first = ExampleAutomata.get("Only zeros").get();
        first.setAcceptingStates(List.of("q1"));
        assertEquals(Set.of("q0"), ExampleAutomata.get("Only zeros").get().getAcceptingStates());
    }

    @Test
    void unknownExampleIsEmpty() {
        assertFalse(ExampleAutomata.get("Palindromes").isPresent());
    }

    @Test
    void onlyZerosLanguage() throws InvalidDefinitionException, InvalidInputException {
        Dfa dfa = Dfa.apply(ExampleAutomata.get("Only zeros").get());
        assertTrue(Simulator.run(dfa, "000").isAccepted());
        assertFalse(Simulator.run(dfa, "010").isAccepted());
        assertEquals(List.of("", "0", "00"), LanguageEnumerator.enumerateAccepted(dfa, 3, 20));
    }
}
