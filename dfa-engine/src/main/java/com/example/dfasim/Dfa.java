package com.example.dfasim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A validated, immutable DFA ready for simulation and enumeration.
 *
 * <p>States and symbols are interned to indices and the transition function
 * is stored as a {@code [state][symbol]} table where {@link #NO_STATE} marks
 * an undefined transition.
 */
public final class Dfa {

    private static final Logger logger = LoggerFactory.getLogger(Dfa.class);

    /** Sentinel for "no transition" and "no initial state". */
    public static final int NO_STATE = -1;

    private final DfaDefinition definition;
    private final String[] stateNames;
    private final String[] symbols;
    private final Map<String, Integer> stateIndex;
    private final Map<String, Integer> symbolIndex;
    private final int[][] table;
    private final boolean[] accepting;
    private final int initial;

    private Dfa(DfaDefinition definition) {
        this.definition = definition;

        stateNames = definition.getStates().toArray(new String[0]);
        stateIndex = new HashMap<>();
        for (int i = 0; i < stateNames.length; i++) {
            stateIndex.put(stateNames[i], i);
        }

        // Repeated alphabet entries keep their first position
        symbols = new LinkedHashSet<>(definition.getAlphabet()).toArray(new String[0]);
        symbolIndex = new HashMap<>();
        for (int i = 0; i < symbols.length; i++) {
            symbolIndex.put(symbols[i], i);
        }

        table = new int[stateNames.length][symbols.length];
        for (int[] row : table) {
            Arrays.fill(row, NO_STATE);
        }
        for (Map.Entry<String, Map<String, String>> row : definition.getTransitions().entrySet()) {
            int from = stateIndex.get(row.getKey());
            for (Map.Entry<String, String> move : row.getValue().entrySet()) {
                table[from][symbolIndex.get(move.getKey())] = stateIndex.get(move.getValue());
            }
        }

        accepting = new boolean[stateNames.length];
        for (String state : definition.getAcceptingStates()) {
            accepting[stateIndex.get(state)] = true;
        }

        String initialName = definition.getInitialState();
        initial = initialName == null ? NO_STATE : stateIndex.get(initialName);
    }

    /**
     * Validates the definition and compiles a snapshot of it. Later changes to
     * {@code definition} do not affect the returned automaton.
     *
     * @throws InvalidDefinitionException if the definition is not a well-formed DFA
     */
    public static Dfa apply(DfaDefinition definition) throws InvalidDefinitionException {
        DfaDefinition snapshot = definition.copy();
        DefinitionValidator.validate(snapshot);
        Dfa dfa = new Dfa(snapshot);
        logger.debug("Applied DFA with {} states over {} symbols", dfa.stateCount(), dfa.symbolCount());
        return dfa;
    }

    public int stateCount() { return stateNames.length; }
    public int symbolCount() { return symbols.length; }

    public String stateName(int state) { return stateNames[state]; }
    public String symbol(int symbol) { return symbols[symbol]; }

    /**
     * @return index of the symbol, or {@link #NO_STATE} if it is not in the alphabet
     */
    public int symbolIndex(String symbol) {
        Integer index = symbolIndex.get(symbol);
        return index == null ? NO_STATE : index;
    }

    public boolean inAlphabet(String symbol) {
        return symbolIndex.containsKey(symbol);
    }

    /**
     * @return the initial state index, or {@link #NO_STATE} when the definition has none
     */
    public int initialState() { return initial; }

    /**
     * @return destination index, or {@link #NO_STATE} if the transition is undefined
     */
    public int next(int state, int symbol) {
        if (state == NO_STATE) {
            return NO_STATE;
        }
        return table[state][symbol];
    }

    public boolean isAccepting(int state) {
        return state != NO_STATE && accepting[state];
    }

    public boolean isEmpty() {
        return stateNames.length == 0;
    }

    /**
     * @return a copy of the definition this automaton was applied from
     */
    public DfaDefinition definition() {
        return definition.copy();
    }
}
