package com.example.dfasim;

import java.util.*;

/**
 * The 5-tuple of a deterministic finite automaton, as entered by the user.
 *
 * <p>Mutable while it is being assembled and never checked on construction:
 * run it through {@link DefinitionValidator} (or {@link Dfa#apply}) before
 * trusting it.
 *
 * <p>The transition table holds at most one destination per
 * {@code (state, symbol)} pair. Putting a pair that is already present
 * replaces its destination (last insert wins).
 */
public class DfaDefinition {

    private final Set<String> states = new LinkedHashSet<>();
    private final List<String> alphabet = new ArrayList<>();
    private String initialState;
    private final Set<String> acceptingStates = new LinkedHashSet<>();
    private final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();

    public DfaDefinition() {}

    public DfaDefinition(Collection<String> states, List<String> alphabet, String initialState,
                         Collection<String> acceptingStates, Map<String, Map<String, String>> transitions) {
        setStates(states);
        setAlphabet(alphabet);
        setInitialState(initialState);
        setAcceptingStates(acceptingStates);
        setTransitions(transitions);
    }

    public Set<String> getStates() { return Collections.unmodifiableSet(states); }
    public void setStates(Collection<String> states) {
        this.states.clear();
        if (states != null) {
            this.states.addAll(states);
        }
    }

    public List<String> getAlphabet() { return Collections.unmodifiableList(alphabet); }
    public void setAlphabet(List<String> alphabet) {
        this.alphabet.clear();
        if (alphabet != null) {
            this.alphabet.addAll(alphabet);
        }
    }

    /**
     * @return the initial state, or {@code null} when none is set
     */
    public String getInitialState() { return initialState; }

    /**
     * An empty name counts as "no initial state".
     */
    public void setInitialState(String initialState) {
        this.initialState = initialState == null || initialState.isEmpty() ? null : initialState;
    }

    public Set<String> getAcceptingStates() { return Collections.unmodifiableSet(acceptingStates); }
    public void setAcceptingStates(Collection<String> acceptingStates) {
        this.acceptingStates.clear();
        if (acceptingStates != null) {
            this.acceptingStates.addAll(acceptingStates);
        }
    }

    /**
     * @return read-only view of source state to (symbol to destination)
     */
    public Map<String, Map<String, String>> getTransitions() {
        Map<String, Map<String, String>> view = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> row : transitions.entrySet()) {
            view.put(row.getKey(), Collections.unmodifiableMap(row.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    public void setTransitions(Map<String, Map<String, String>> transitions) {
        this.transitions.clear();
        if (transitions == null) {
            return;
        }
        for (Map.Entry<String, Map<String, String>> row : transitions.entrySet()) {
            Map<String, String> targets = this.transitions.computeIfAbsent(row.getKey(), k -> new LinkedHashMap<>());
            if (row.getValue() != null) {
                targets.putAll(row.getValue());
            }
        }
    }

    /**
     * Defines {@code source --symbol--> target}, replacing any destination
     * already defined for the same pair.
     *
     * @return the destination that was replaced, or {@code null}
     */
    public String putTransition(String source, String symbol, String target) {
        return transitions.computeIfAbsent(source, k -> new LinkedHashMap<>()).put(symbol, target);
    }

    /**
     * @return destination of {@code source --symbol-->}, or {@code null} if undefined
     */
    public String transition(String source, String symbol) {
        Map<String, String> row = transitions.get(source);
        return row == null ? null : row.get(symbol);
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public DfaDefinition copy() {
        return new DfaDefinition(states, alphabet, initialState, acceptingStates, transitions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DfaDefinition)) return false;
        DfaDefinition that = (DfaDefinition) o;
        return states.equals(that.states)
            && alphabet.equals(that.alphabet)
            && Objects.equals(initialState, that.initialState)
            && acceptingStates.equals(that.acceptingStates)
            && transitions.equals(that.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, initialState, acceptingStates, transitions);
    }

    @Override
    public String toString() {
        return "DfaDefinition{states=" + states + ", alphabet=" + alphabet + ", initial=" + initialState
            + ", accepting=" + acceptingStates + ", transitions=" + transitions + "}";
    }
}
